package me.golemcore.turns.domain.model.action;

public enum ActionKind {
    FUNCTION, HANDOFF, COMPUTER, SHELL, APPLY_PATCH, MCP_APPROVAL
}
