package me.golemcore.turns.domain.model.action;

import me.golemcore.turns.domain.component.Handoff;
import me.golemcore.turns.domain.model.protocol.FunctionCall;

public record HandoffAction(int sequence, FunctionCall rawItem, Handoff handoff) implements ToolAction {

    @Override
    public ActionKind kind() {
        return ActionKind.HANDOFF;
    }

    @Override
    public String toolName() {
        return handoff.getToolName();
    }
}
