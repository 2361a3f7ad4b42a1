package me.golemcore.turns.domain.model.protocol;

import java.util.List;

public record ShellCallOutput(String callId, List<CommandOutput> output, Integer maxOutputLength) implements ModelItem {

    @Override
    public ModelItemKind kind() {
        return ModelItemKind.SHELL_CALL_OUTPUT;
    }

    public record CommandOutput(String stdout, String stderr, Outcome outcome) {
    }

    /**
     * How a command ended: {@code exit} with an optional exit code, or
     * {@code timeout}.
     */
    public record Outcome(String type, Integer exitCode) {

        public static Outcome exit(Integer exitCode) {
            return new Outcome("exit", exitCode);
        }

        public static Outcome timeout() {
            return new Outcome("timeout", null);
        }
    }
}
