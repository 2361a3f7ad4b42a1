package me.golemcore.turns.domain.model.step;

public record RunAgain() implements NextStep {

    @Override
    public Kind kind() {
        return Kind.RUN_AGAIN;
    }
}
