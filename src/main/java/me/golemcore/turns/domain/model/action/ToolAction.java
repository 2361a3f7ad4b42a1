package me.golemcore.turns.domain.model.action;

import me.golemcore.turns.domain.model.protocol.ModelItem;

/**
 * Pairs one raw tool-call record with the handler resolved for it. Built once
 * per turn by classification and consumed once by dispatch.
 */
public sealed interface ToolAction permits FunctionToolAction, HandoffAction, ComputerToolAction, ShellToolAction,
        ApplyPatchToolAction, McpApprovalAction {

    /** Position of the originating entry in the model response. */
    int sequence();

    ActionKind kind();

    ModelItem rawItem();

    String toolName();

    default String callId() {
        return rawItem().callId();
    }
}
