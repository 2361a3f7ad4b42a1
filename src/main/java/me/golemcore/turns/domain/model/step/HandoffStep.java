package me.golemcore.turns.domain.model.step;

import me.golemcore.turns.domain.model.Agent;

public record HandoffStep(Agent newAgent) implements NextStep {

    @Override
    public Kind kind() {
        return Kind.HANDOFF;
    }
}
