package me.golemcore.turns.domain.system.turn;

import me.golemcore.turns.domain.model.Agent;
import me.golemcore.turns.domain.model.CancellationToken;
import me.golemcore.turns.domain.model.RunContext;

import java.time.Duration;

/**
 * Everything an action executor needs besides the action itself.
 *
 * @param actionTimeout
 *            upper bound for each awaited handler, guardrail or callback; zero
 *            disables it
 */
public record DispatchContext(Agent agent, RunContext runContext, CancellationToken cancellation,
        Duration actionTimeout) {
}
