package me.golemcore.turns.domain.model.protocol;

import java.util.List;

public record ShellCall(String id, String callId, Action action, String status) implements ModelItem {

    @Override
    public ModelItemKind kind() {
        return ModelItemKind.SHELL_CALL;
    }

    /**
     * Commands to run, in order.
     *
     * @param commands
     *            command lines
     * @param timeoutMs
     *            optional per-call timeout requested by the model
     * @param maxOutputLength
     *            optional output cap requested by the model
     */
    public record Action(List<String> commands, Long timeoutMs, Integer maxOutputLength) {
    }
}
