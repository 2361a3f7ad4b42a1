package me.golemcore.turns.domain.model;

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

import java.util.List;
import java.util.Set;
import java.util.function.BiFunction;

/**
 * Decides whether function tool results end the turn with a final output
 * instead of running the model again.
 */
public final class ToolUseBehavior {

    public enum Mode {
        RUN_LLM_AGAIN, STOP_ON_FIRST_TOOL, STOP_AT_TOOL_NAMES, CUSTOM
    }

    private final Mode mode;
    private final Set<String> stopAtToolNames;
    private final BiFunction<RunContext, List<FunctionToolResult>, ToolsToFinalOutputResult> decider;

    private ToolUseBehavior(Mode mode, Set<String> stopAtToolNames,
            BiFunction<RunContext, List<FunctionToolResult>, ToolsToFinalOutputResult> decider) {
        this.mode = mode;
        this.stopAtToolNames = stopAtToolNames;
        this.decider = decider;
    }

    public static ToolUseBehavior runLlmAgain() {
        return new ToolUseBehavior(Mode.RUN_LLM_AGAIN, Set.of(), null);
    }

    public static ToolUseBehavior stopOnFirstTool() {
        return new ToolUseBehavior(Mode.STOP_ON_FIRST_TOOL, Set.of(), null);
    }

    public static ToolUseBehavior stopAtToolNames(String... toolNames) {
        return new ToolUseBehavior(Mode.STOP_AT_TOOL_NAMES, Set.of(toolNames), null);
    }

    public static ToolUseBehavior custom(
            BiFunction<RunContext, List<FunctionToolResult>, ToolsToFinalOutputResult> decider) {
        return new ToolUseBehavior(Mode.CUSTOM, Set.of(), decider);
    }

    public Mode getMode() {
        return mode;
    }

    public ToolsToFinalOutputResult evaluate(RunContext context, List<FunctionToolResult> results) {
        List<FunctionToolResult> executed = results.stream().filter(FunctionToolResult::executed).toList();
        if (executed.isEmpty()) {
            return ToolsToFinalOutputResult.notFinal();
        }
        return switch (mode) {
        case RUN_LLM_AGAIN -> ToolsToFinalOutputResult.notFinal();
        case STOP_ON_FIRST_TOOL -> ToolsToFinalOutputResult.finalOutput(executed.get(0).output());
        case STOP_AT_TOOL_NAMES -> executed.stream()
                .filter(result -> stopAtToolNames.contains(result.toolName()))
                .findFirst()
                .map(result -> ToolsToFinalOutputResult.finalOutput(result.output()))
                .orElse(ToolsToFinalOutputResult.notFinal());
        case CUSTOM -> {
            ToolsToFinalOutputResult decided = decider.apply(context, executed);
            yield decided != null ? decided : ToolsToFinalOutputResult.notFinal();
        }
        };
    }
}
