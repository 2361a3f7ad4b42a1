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

import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.turns.domain.model.RunContext;
import me.golemcore.turns.domain.model.ToolArguments;
import me.golemcore.turns.domain.model.ToolDefinition;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Function tool assembled from a definition and a synchronous handler.
 *
 * <p>
 * Handler exceptions are converted into a textual result by the
 * {@link ToolErrorFormatter}. Build with {@code errorFormatter(null)} to let
 * them propagate and abort the turn instead.
 */
@Getter
@Builder
@Slf4j
public class FunctionTool implements FunctionToolComponent {

    private final ToolDefinition definition;
    private final ToolHandler handler;

    @Builder.Default
    private final ToolApprovalPolicy<ToolArguments> approvalPolicy = ToolApprovalPolicy.never();

    @Builder.Default
    private final ToolErrorFormatter errorFormatter = ToolErrorFormatter.DEFAULT;

    @Builder.Default
    private final List<ToolInputGuardrail> inputGuardrails = List.of();

    @Builder.Default
    private final List<ToolOutputGuardrail> outputGuardrails = List.of();

    @Builder.Default
    private final boolean enabled = true;

    @Override
    public CompletableFuture<Boolean> needsApproval(RunContext context, ToolArguments arguments, String callId) {
        return approvalPolicy.needsApproval(context, arguments, callId);
    }

    @Override
    public CompletableFuture<Object> invoke(RunContext context, ToolArguments arguments) {
        Objects.requireNonNull(handler, "handler");
        try {
            return CompletableFuture.completedFuture(handler.handle(context, arguments));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CompletableFuture.failedFuture(e);
        } catch (Exception e) { // NOSONAR - handler failures become tool output
            if (errorFormatter == null) {
                return CompletableFuture.failedFuture(e);
            }
            log.debug("[Tools] '{}' failed, returning error text to the model: {}", getToolName(), e.getMessage());
            return CompletableFuture.completedFuture(errorFormatter.format(context, e));
        }
    }
}
