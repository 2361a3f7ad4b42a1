package me.golemcore.turns.domain.model.action;

import me.golemcore.turns.domain.component.ComputerToolComponent;
import me.golemcore.turns.domain.model.protocol.ComputerCall;

public record ComputerToolAction(int sequence, ComputerCall rawItem, ComputerToolComponent tool) implements ToolAction {

    @Override
    public ActionKind kind() {
        return ActionKind.COMPUTER;
    }

    @Override
    public String toolName() {
        return tool.getToolName();
    }
}
