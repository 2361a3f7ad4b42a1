package me.golemcore.turns.domain.system.turn;

import me.golemcore.turns.domain.exception.RunCancelledException;

import java.util.List;

/**
 * Cancellation raised from tool dispatch, with the outcomes of the actions
 * that completed before it, in response order.
 */
class DispatchCancelledException extends RunCancelledException {

    private static final long serialVersionUID = 1L;

    private final transient List<ActionOutcome> completedOutcomes;

    DispatchCancelledException(String message, Throwable cause, List<ActionOutcome> completedOutcomes) {
        super(message, cause);
        this.completedOutcomes = List.copyOf(completedOutcomes);
    }

    List<ActionOutcome> completedOutcomes() {
        return completedOutcomes;
    }
}
