package me.golemcore.turns.domain.system.turn;

import me.golemcore.turns.domain.exception.RunCancelledException;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Blocking waits on tool, guardrail and callback futures from dispatch
 * threads.
 */
final class Awaits {

    private Awaits() {
    }

    static <T> T await(CompletableFuture<T> future, Duration timeout) {
        try {
            if (timeout == null || timeout.isZero() || timeout.isNegative()) {
                return future.get();
            }
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new RunCancelledException("Interrupted while waiting for a tool", e);
        } catch (ExecutionException e) {
            throw propagate(e.getCause());
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new CompletionException(new TimeoutException("Timed out after " + timeout.toMillis() + " ms"));
        }
    }

    static RuntimeException propagate(Throwable error) {
        if (error instanceof RuntimeException runtime) {
            return runtime;
        }
        if (error instanceof Error fatal) {
            throw fatal;
        }
        return new CompletionException(error);
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    static String describe(Throwable error) {
        Throwable cause = unwrap(error);
        String message = cause.getMessage();
        return message != null && !message.isBlank() ? message : cause.getClass().getSimpleName();
    }
}
