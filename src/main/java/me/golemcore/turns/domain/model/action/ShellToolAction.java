package me.golemcore.turns.domain.model.action;

import me.golemcore.turns.domain.component.ShellToolComponent;
import me.golemcore.turns.domain.model.protocol.ShellCall;

public record ShellToolAction(int sequence, ShellCall rawItem, ShellToolComponent tool) implements ToolAction {

    @Override
    public ActionKind kind() {
        return ActionKind.SHELL;
    }

    @Override
    public String toolName() {
        return tool.getToolName();
    }
}
