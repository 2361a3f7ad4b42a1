package me.golemcore.turns.domain.model.action;

import me.golemcore.turns.domain.component.FunctionToolComponent;
import me.golemcore.turns.domain.model.protocol.FunctionCall;

public record FunctionToolAction(int sequence, FunctionCall rawItem, FunctionToolComponent tool) implements ToolAction {

    @Override
    public ActionKind kind() {
        return ActionKind.FUNCTION;
    }

    @Override
    public String toolName() {
        return tool.getToolName();
    }
}
