package me.golemcore.turns.domain.model.step;

public record FinalOutput(String output) implements NextStep {

    @Override
    public Kind kind() {
        return Kind.FINAL_OUTPUT;
    }
}
