package me.golemcore.turns.domain.component;

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

import me.golemcore.turns.domain.model.RunContext;
import me.golemcore.turns.domain.model.ToolArguments;
import me.golemcore.turns.domain.model.protocol.FunctionCall;

import java.util.concurrent.CompletableFuture;

/**
 * Runs before an approved function tool is invoked and may replace its result
 * or abort the run.
 */
public interface ToolInputGuardrail {

    String getName();

    CompletableFuture<GuardrailOutput> check(RunContext context, String agentName, FunctionCall call,
            ToolArguments arguments);
}
