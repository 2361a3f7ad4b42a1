package me.golemcore.turns.domain.system.turn;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.turns.domain.exception.RunCancelledException;
import me.golemcore.turns.domain.model.action.ApplyPatchToolAction;
import me.golemcore.turns.domain.model.action.ComputerToolAction;
import me.golemcore.turns.domain.model.action.FunctionToolAction;
import me.golemcore.turns.domain.model.action.McpApprovalAction;
import me.golemcore.turns.domain.model.action.ShellToolAction;
import me.golemcore.turns.domain.model.action.ToolAction;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs every action of a turn concurrently and returns the outcomes in response
 * order, regardless of completion order.
 *
 * <p>
 * Handoffs are not dispatched here; at most one of them runs, after the other
 * actions, through {@link HandoffExecutor}. When any action fails, the failure
 * of the earliest failing action is rethrown once all actions have settled.
 *
 * <p>
 * On cancellation, actions that have not started never start and running ones
 * are interrupted and given {@link #SETTLE_TIMEOUT} to finish. Outcomes that
 * completed normally travel with the {@link RunCancelledException} so that
 * their results are kept.
 */
@Slf4j
public class ActionDispatcher {

    static final Duration SETTLE_TIMEOUT = Duration.ofSeconds(2);

    private final ExecutorService executor;
    private final FunctionToolExecutor functionToolExecutor;
    private final ComputerActionExecutor computerActionExecutor;
    private final ShellActionExecutor shellActionExecutor;
    private final ApplyPatchActionExecutor applyPatchActionExecutor;
    private final McpApprovalExecutor mcpApprovalExecutor;

    public ActionDispatcher(ExecutorService executor, FunctionToolExecutor functionToolExecutor,
            ComputerActionExecutor computerActionExecutor, ShellActionExecutor shellActionExecutor,
            ApplyPatchActionExecutor applyPatchActionExecutor, McpApprovalExecutor mcpApprovalExecutor) {
        this.executor = executor;
        this.functionToolExecutor = functionToolExecutor;
        this.computerActionExecutor = computerActionExecutor;
        this.shellActionExecutor = shellActionExecutor;
        this.applyPatchActionExecutor = applyPatchActionExecutor;
        this.mcpApprovalExecutor = mcpApprovalExecutor;
    }

    public List<ActionOutcome> dispatch(DispatchContext context, List<? extends ToolAction> actions) {
        if (actions == null || actions.isEmpty()) {
            return List.of();
        }
        if (context.cancellation() != null) {
            context.cancellation().throwIfCancelled();
        }
        List<ToolAction> ordered = new ArrayList<>(actions);
        ordered.sort(Comparator.comparingInt(ToolAction::sequence));
        log.debug("[Dispatch] {} action(s) for agent '{}'", ordered.size(), context.agent().getName());

        List<CompletableFuture<ActionOutcome>> results = new ArrayList<>(ordered.size());
        List<AtomicBoolean> claims = new ArrayList<>(ordered.size());
        List<Future<?>> tasks = new ArrayList<>(ordered.size());
        for (ToolAction action : ordered) {
            CompletableFuture<ActionOutcome> result = new CompletableFuture<>();
            AtomicBoolean claim = new AtomicBoolean();
            results.add(result);
            claims.add(claim);
            tasks.add(executor.submit(() -> {
                if (!claim.compareAndSet(false, true)) {
                    return;
                }
                try {
                    result.complete(executeOne(context, action));
                } catch (Throwable e) { // NOSONAR - surfaced to the dispatching thread
                    result.completeExceptionally(e);
                }
            }));
        }

        awaitAll(context, results, claims, tasks);

        List<ActionOutcome> outcomes = new ArrayList<>(results.size());
        for (CompletableFuture<ActionOutcome> result : results) {
            try {
                outcomes.add(result.join());
            } catch (CompletionException e) {
                throw Awaits.propagate(e.getCause());
            }
        }
        return outcomes;
    }

    private void awaitAll(DispatchContext context, List<CompletableFuture<ActionOutcome>> results,
            List<AtomicBoolean> claims, List<Future<?>> tasks) {
        CompletableFuture<Void> all = CompletableFuture.allOf(results.toArray(new CompletableFuture<?>[0]));
        CompletableFuture<Void> cancelled = context.cancellation() != null
                ? context.cancellation().whenCancelled()
                : new CompletableFuture<>();
        try {
            CompletableFuture.anyOf(all, cancelled).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw abort(results, claims, tasks, "Interrupted while dispatching tool calls", e);
        } catch (ExecutionException | CancellationException e) {
            // a failed action; reported below in response order
            log.debug("[Dispatch] action failed: {}", Awaits.describe(e));
        }
        if (cancelled.isDone() && !all.isDone()) {
            throw abort(results, claims, tasks, "Run cancelled during tool dispatch", null);
        }
    }

    private DispatchCancelledException abort(List<CompletableFuture<ActionOutcome>> results,
            List<AtomicBoolean> claims, List<Future<?>> tasks, String message, Throwable cause) {
        for (int index = 0; index < results.size(); index++) {
            if (claims.get(index).compareAndSet(false, true)) {
                results.get(index).completeExceptionally(new CancellationException("Not started"));
            }
        }
        for (Future<?> task : tasks) {
            task.cancel(true);
        }
        settle(results);

        List<ActionOutcome> completed = new ArrayList<>();
        for (CompletableFuture<ActionOutcome> result : results) {
            if (result.isDone() && !result.isCompletedExceptionally()) {
                completed.add(result.join());
            }
        }
        log.info("[Dispatch] run cancelled, {} of {} action(s) completed", completed.size(), results.size());
        return new DispatchCancelledException(message, cause, completed);
    }

    /**
     * Waits for interrupted actions to finish. The caller's interrupt status
     * is restored afterwards.
     */
    private void settle(List<CompletableFuture<ActionOutcome>> results) {
        boolean interrupted = Thread.interrupted();
        try {
            CompletableFuture.allOf(results.toArray(new CompletableFuture<?>[0]))
                    .get(SETTLE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            interrupted = true;
        } catch (ExecutionException | CancellationException e) {
            log.debug("[Dispatch] action ended by cancellation: {}", Awaits.describe(e));
        } catch (TimeoutException e) {
            long running = results.stream().filter(result -> !result.isDone()).count();
            log.warn("[Dispatch] {} action(s) still running {} ms after cancellation, their results are dropped",
                    running, SETTLE_TIMEOUT.toMillis());
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private ActionOutcome executeOne(DispatchContext context, ToolAction action) {
        return switch (action.kind()) {
        case FUNCTION -> functionToolExecutor.execute(context, (FunctionToolAction) action);
        case COMPUTER -> computerActionExecutor.execute(context, (ComputerToolAction) action);
        case SHELL -> shellActionExecutor.execute(context, (ShellToolAction) action);
        case APPLY_PATCH -> applyPatchActionExecutor.execute(context, (ApplyPatchToolAction) action);
        case MCP_APPROVAL -> mcpApprovalExecutor.execute(context, (McpApprovalAction) action);
        case HANDOFF -> throw new IllegalArgumentException("Handoffs are not dispatched as tool calls");
        };
    }
}
