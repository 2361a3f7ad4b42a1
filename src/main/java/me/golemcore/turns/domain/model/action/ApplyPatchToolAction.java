package me.golemcore.turns.domain.model.action;

import me.golemcore.turns.domain.component.ApplyPatchToolComponent;
import me.golemcore.turns.domain.model.protocol.ApplyPatchCall;

public record ApplyPatchToolAction(int sequence, ApplyPatchCall rawItem, ApplyPatchToolComponent tool)
        implements ToolAction {

    @Override
    public ActionKind kind() {
        return ActionKind.APPLY_PATCH;
    }

    @Override
    public String toolName() {
        return tool.getToolName();
    }
}
