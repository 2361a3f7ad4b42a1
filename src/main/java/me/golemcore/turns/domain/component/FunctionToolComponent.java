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
import me.golemcore.turns.domain.model.ToolDefinition;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Function tool: a named handler the model calls with JSON arguments.
 */
public interface FunctionToolComponent extends ToolComponent {

    /**
     * Returns the tool definition with the JSON Schema arguments are parsed
     * against.
     *
     * @return the tool definition
     */
    ToolDefinition getDefinition();

    @Override
    default String getToolName() {
        return getDefinition().getName();
    }

    @Override
    default ToolKind getToolKind() {
        return ToolKind.FUNCTION;
    }

    default CompletableFuture<Boolean> needsApproval(RunContext context, ToolArguments arguments, String callId) {
        return CompletableFuture.completedFuture(false);
    }

    /**
     * Invokes the tool. A returned error value is an ordinary result; an
     * exceptional completion aborts the turn.
     *
     * @param context
     *            run context
     * @param arguments
     *            parsed arguments
     * @return a future with the tool output
     */
    CompletableFuture<Object> invoke(RunContext context, ToolArguments arguments);

    default List<ToolInputGuardrail> getInputGuardrails() {
        return List.of();
    }

    default List<ToolOutputGuardrail> getOutputGuardrails() {
        return List.of();
    }
}
