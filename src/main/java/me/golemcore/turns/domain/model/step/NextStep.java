package me.golemcore.turns.domain.model.step;

/**
 * What the run loop does after a turn. Exactly one variant is produced per
 * resolver invocation.
 */
public sealed interface NextStep permits RunAgain, HandoffStep, FinalOutput, Interruption {

    Kind kind();

    enum Kind {
        RUN_AGAIN, HANDOFF, FINAL_OUTPUT, INTERRUPTION
    }
}
