package me.golemcore.turns.domain.model;

import me.golemcore.turns.domain.exception.RunCancelledException;

import java.util.concurrent.CompletableFuture;

/**
 * Cooperative cancellation signal for one run. Cancelling aborts the in-flight
 * dispatch; the run stays resumable from its last committed state.
 */
public class CancellationToken {

    private final CompletableFuture<Void> signal = new CompletableFuture<>();

    public void cancel() {
        signal.complete(null);
    }

    public boolean isCancelled() {
        return signal.isDone();
    }

    /** Completes when the token is cancelled. */
    public CompletableFuture<Void> whenCancelled() {
        return signal.thenApply(ignored -> null);
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new RunCancelledException("Run cancelled");
        }
    }
}
