package me.golemcore.turns.domain.loop;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.turns.domain.model.Agent;
import me.golemcore.turns.domain.model.item.RunItem;
import me.golemcore.turns.domain.model.item.ToolApprovalItem;

import java.util.List;

/**
 * Outcome of a run: a final output, or the approvals it stopped on.
 *
 * @param state
 *            resumable state; record decisions on it and pass it back to
 *            {@link AgentRunner#resume(RunState, RunOptions)}
 */
public record RunResult(String finalOutput, List<ToolApprovalItem> interruptions, Agent lastAgent,
        List<RunItem> newItems, RunState state) {

    public RunResult {
        interruptions = List.copyOf(interruptions);
        newItems = List.copyOf(newItems);
    }

    public boolean isInterrupted() {
        return !interruptions.isEmpty();
    }
}
