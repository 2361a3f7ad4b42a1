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
import me.golemcore.turns.domain.model.protocol.ShellCall;
import me.golemcore.turns.domain.model.protocol.ShellCallOutput;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Local shell the model can run commands in.
 */
public interface ShellToolComponent extends ToolComponent {

    @Override
    default String getToolName() {
        return "shell";
    }

    @Override
    default ToolKind getToolKind() {
        return ToolKind.SHELL;
    }

    /**
     * Runs the commands of one shell call.
     *
     * @param context
     *            run context
     * @param action
     *            commands requested by the model
     * @return per-command output
     * @throws Exception
     *             if the shell could not run the commands; the failure is
     *             reported to the model as stderr
     */
    ShellResult execute(RunContext context, ShellCall.Action action) throws Exception;

    default CompletableFuture<Boolean> needsApproval(RunContext context, ShellCall.Action action, String callId) {
        return CompletableFuture.completedFuture(false);
    }

    default ApprovalCallback getApprovalCallback() {
        return null;
    }

    record ShellResult(List<ShellCallOutput.CommandOutput> output, Integer maxOutputLength) {
    }
}
