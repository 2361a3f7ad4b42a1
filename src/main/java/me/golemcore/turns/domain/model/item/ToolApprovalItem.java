package me.golemcore.turns.domain.model.item;

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

import me.golemcore.turns.domain.model.protocol.ModelItem;

/**
 * Placeholder for an action whose execution waits on an approve/reject
 * decision.
 *
 * @param rawItem
 *            the gated tool call (or remote approval request)
 * @param toolName
 *            key under which the decision is stored
 */
public record ToolApprovalItem(String id, String agentName, ModelItem rawItem, String toolName) implements RunItem {

    @Override
    public RunItemKind kind() {
        return RunItemKind.TOOL_APPROVAL;
    }
}
