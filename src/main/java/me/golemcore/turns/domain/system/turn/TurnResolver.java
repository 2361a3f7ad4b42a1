package me.golemcore.turns.domain.system.turn;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.turns.domain.model.Agent;
import me.golemcore.turns.domain.model.FunctionToolResult;
import me.golemcore.turns.domain.model.ProcessedResponse;
import me.golemcore.turns.domain.model.ToolsToFinalOutputResult;
import me.golemcore.turns.domain.model.action.ActionKind;
import me.golemcore.turns.domain.model.action.HandoffAction;
import me.golemcore.turns.domain.model.action.ToolAction;
import me.golemcore.turns.domain.model.item.MessageOutputItem;
import me.golemcore.turns.domain.model.item.RunItem;
import me.golemcore.turns.domain.model.item.ToolApprovalItem;
import me.golemcore.turns.domain.model.protocol.HostedToolCall;
import me.golemcore.turns.domain.model.protocol.ModelItem;
import me.golemcore.turns.domain.model.step.FinalOutput;
import me.golemcore.turns.domain.model.step.HandoffStep;
import me.golemcore.turns.domain.model.step.Interruption;
import me.golemcore.turns.domain.model.step.NextStep;
import me.golemcore.turns.domain.model.step.RunAgain;
import me.golemcore.turns.domain.model.step.SingleStepResult;
import me.golemcore.turns.domain.service.ApprovalIdentity;
import me.golemcore.turns.domain.service.RunEventService;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turn state machine. Combines classification and dispatch results into the
 * single next step of the run: run again, hand off, finish or wait for
 * approvals.
 *
 * <p>
 * A fresh turn dispatches every action of the response. A resumed turn
 * dispatches only the actions without a result in history, so approved work
 * runs exactly once and completed work never runs again.
 */
@Slf4j
public class TurnResolver {

    private final ActionDispatcher actionDispatcher;
    private final HandoffExecutor handoffExecutor;
    private final FinalOutputChecker finalOutputChecker;
    private final RunEventService runEventService;
    private final Duration actionTimeout;

    public TurnResolver(ActionDispatcher actionDispatcher, HandoffExecutor handoffExecutor,
            FinalOutputChecker finalOutputChecker, RunEventService runEventService, Duration actionTimeout) {
        this.actionDispatcher = actionDispatcher;
        this.handoffExecutor = handoffExecutor;
        this.finalOutputChecker = finalOutputChecker;
        this.runEventService = runEventService;
        this.actionTimeout = actionTimeout;
    }

    /**
     * Resolves a turn for a response the model just produced.
     */
    public SingleStepResult resolveTurnAfterModelResponse(TurnRequest request) {
        Agent agent = request.getAgent();
        ProcessedResponse processed = request.getProcessedResponse();
        DispatchContext context = dispatchContext(request);
        List<RunItem> preStepItems = request.getPreStepItems();

        TurnHistoryWriter history = new TurnHistoryWriter(preStepItems);
        processed.newItems().forEach(history::append);

        List<ActionOutcome> outcomes = dispatch(context, processed.dispatchableActions(), preStepItems, history);
        List<ToolApprovalItem> interruptions = new ArrayList<>();
        List<FunctionToolResult> functionResults = new ArrayList<>();
        for (ActionOutcome outcome : outcomes) {
            record(history, outcome, interruptions, functionResults);
        }
        interruptions.forEach(approval -> runEventService.approvalRequested(agent, approval));

        int persistedItemCount = request.getPersistedItemCount();
        if (!interruptions.isEmpty()) {
            return interrupted(request, preStepItems, history, interruptions, persistedItemCount);
        }
        if (!processed.handoffs().isEmpty()) {
            return handoff(request, context, processed.handoffs(), preStepItems, history, persistedItemCount);
        }
        NextStep next = finalFromTools(agent, context, functionResults);
        if (next == null) {
            next = decideFromMessages(agent, processed, history.newItems());
        }
        return result(request, preStepItems, history.newItems(), next, persistedItemCount);
    }

    /**
     * Resumes a turn that ended in an interruption, or was cancelled before it
     * committed, using the approval decisions recorded since.
     *
     * <p>
     * Placeholders of the approvals the turn waited on leave the inherited
     * history; the ones still pending come back as new items. The persisted
     * item count shrinks by the number of placeholders removed, so results of
     * the approved calls are flushed to the session exactly once.
     */
    public SingleStepResult resolveInterruptedTurn(TurnRequest request) {
        Agent agent = request.getAgent();
        ProcessedResponse processed = request.getProcessedResponse();
        DispatchContext context = dispatchContext(request);
        List<RunItem> originalPreStepItems = request.getPreStepItems();

        Map<String, ToolApprovalItem> waitingOn = new HashMap<>();
        for (ToolApprovalItem approval : request.getPendingApprovals()) {
            waitingOn.putIfAbsent(ApprovalIdentity.of(approval), approval);
        }
        Map<String, ToolApprovalItem> removed = matchPlaceholders(originalPreStepItems, waitingOn.keySet());
        int persistedItemCount = Math.max(0, request.getPersistedItemCount() - removed.size());
        Set<String> removedIds = new HashSet<>();
        removed.values().forEach(item -> removedIds.add(item.id()));
        List<RunItem> preStepItems = originalPreStepItems.stream()
                .filter(item -> !removedIds.contains(item.id()))
                .toList();
        if (!removed.isEmpty()) {
            log.debug("[Turn] rewound persisted item count by {} for '{}'", removed.size(), agent.getName());
        }

        TurnHistoryWriter history = new TurnHistoryWriter(preStepItems);
        Set<String> knownIds = new HashSet<>();
        originalPreStepItems.forEach(item -> knownIds.add(item.id()));
        for (RunItem item : processed.newItems()) {
            if (!knownIds.contains(item.id()) && !(item instanceof ToolApprovalItem)) {
                history.append(item);
            }
        }

        Set<String> completed = completedCalls(originalPreStepItems);
        List<ToolAction> remaining = processed.dispatchableActions().stream()
                .filter(action -> !completed.contains(key(action.kind(), action.callId())))
                .toList();
        log.debug("[Turn] resuming '{}': {} of {} action(s) left to dispatch", agent.getName(), remaining.size(),
                processed.dispatchableActions().size());

        List<ActionOutcome> outcomes = dispatch(context, remaining, originalPreStepItems, history);
        List<ToolApprovalItem> interruptions = new ArrayList<>();
        List<FunctionToolResult> functionResults = new ArrayList<>();
        for (ActionOutcome outcome : outcomes) {
            ToolApprovalItem pending = outcome.pendingApproval();
            if (pending != null) {
                ToolApprovalItem original = removed.get(ApprovalIdentity.of(pending));
                if (original != null) {
                    outcome = new ActionOutcome(outcome.sequence(), outcome.items(), original,
                            outcome.functionResult());
                } else {
                    runEventService.approvalRequested(agent, pending);
                }
            }
            record(history, outcome, interruptions, functionResults);
        }

        if (!interruptions.isEmpty()) {
            return interrupted(request, preStepItems, history, interruptions, persistedItemCount);
        }
        List<HandoffAction> pendingHandoffs = processed.handoffs().stream()
                .filter(action -> !completed.contains(key(ActionKind.HANDOFF, action.callId())))
                .toList();
        if (!pendingHandoffs.isEmpty()) {
            return handoff(request, context, pendingHandoffs, preStepItems, history, persistedItemCount);
        }
        NextStep next = finalFromTools(agent, context, functionResults);
        return result(request, preStepItems, history.newItems(), next != null ? next : new RunAgain(),
                persistedItemCount);
    }

    /**
     * Dispatches the actions. On cancellation the results of actions that had
     * completed join the turn's history, which travels with the exception.
     */
    private List<ActionOutcome> dispatch(DispatchContext context, List<? extends ToolAction> actions,
            List<RunItem> inherited, TurnHistoryWriter history) {
        try {
            return actionDispatcher.dispatch(context, actions);
        } catch (DispatchCancelledException e) {
            for (ActionOutcome outcome : e.completedOutcomes()) {
                outcome.items().forEach(history::append);
            }
            List<RunItem> generated = new ArrayList<>(inherited);
            generated.addAll(history.newItems());
            log.info("[Turn] agent '{}' cancelled during dispatch, keeping {} completed action(s)",
                    context.agent().getName(), e.completedOutcomes().size());
            throw e.withGeneratedItems(generated);
        }
    }

    private void record(TurnHistoryWriter history, ActionOutcome outcome, List<ToolApprovalItem> interruptions,
            List<FunctionToolResult> functionResults) {
        outcome.items().forEach(history::append);
        if (outcome.pendingApproval() != null) {
            history.append(outcome.pendingApproval());
            interruptions.add(outcome.pendingApproval());
        }
        if (outcome.functionResult() != null) {
            functionResults.add(outcome.functionResult());
        }
    }

    private SingleStepResult interrupted(TurnRequest request, List<RunItem> preStepItems,
            TurnHistoryWriter history, List<ToolApprovalItem> interruptions, int persistedItemCount) {
        log.info("[Turn] agent '{}' interrupted, {} approval(s) pending", request.getAgent().getName(),
                interruptions.size());
        return result(request, preStepItems, history.newItems(), new Interruption(interruptions),
                persistedItemCount);
    }

    /**
     * Final output decided by the agent's tool use behavior, or {@code null}.
     */
    private NextStep finalFromTools(Agent agent, DispatchContext context, List<FunctionToolResult> results) {
        ToolsToFinalOutputResult decided = agent.getToolUseBehavior().evaluate(context.runContext(), results);
        if (!decided.isFinalOutput()) {
            return null;
        }
        log.info("[Turn] agent '{}' finished from tool results", agent.getName());
        return new FinalOutput(decided.finalOutput());
    }

    private NextStep decideFromMessages(Agent agent, ProcessedResponse processed, List<RunItem> newItems) {
        if (processed.hasToolsOrApprovalsToRun()) {
            return new RunAgain();
        }
        String candidate = null;
        for (RunItem item : newItems) {
            if (item instanceof MessageOutputItem message) {
                candidate = message.text();
            }
        }
        if (candidate == null) {
            return new RunAgain();
        }
        String output = finalOutputChecker.check(agent, candidate);
        log.info("[Turn] agent '{}' produced its final output", agent.getName());
        return new FinalOutput(output);
    }

    private SingleStepResult handoff(TurnRequest request, DispatchContext context, List<HandoffAction> handoffs,
            List<RunItem> preStepItems, TurnHistoryWriter history, int persistedItemCount) {
        HandoffExecutor.HandoffResolution resolution = handoffExecutor.execute(context, handoffs,
                request.getOriginalInput(), preStepItems, history.newItems(), request.getHandoffInputFilter());
        return new SingleStepResult(resolution.originalInput(), request.getModelResponse(),
                resolution.preStepItems(), resolution.newStepItems(), new HandoffStep(resolution.newAgent()),
                persistedItemCount);
    }

    private SingleStepResult result(TurnRequest request, List<RunItem> preStepItems, List<RunItem> newItems,
            NextStep next, int persistedItemCount) {
        log.debug("[Turn] agent '{}' next step {}", request.getAgent().getName(), next.kind());
        return new SingleStepResult(request.getOriginalInput(), request.getModelResponse(), preStepItems, newItems,
                next, persistedItemCount);
    }

    private DispatchContext dispatchContext(TurnRequest request) {
        return new DispatchContext(request.getAgent(), request.getRunContext(), request.getCancellation(),
                actionTimeout);
    }

    /**
     * Scans history from the end and takes, per identity, the latest placeholder
     * carrying it.
     */
    private static Map<String, ToolApprovalItem> matchPlaceholders(List<RunItem> items, Set<String> identities) {
        Set<String> wanted = new LinkedHashSet<>(identities);
        Map<String, ToolApprovalItem> matched = new HashMap<>();
        for (int index = items.size() - 1; index >= 0 && !wanted.isEmpty(); index--) {
            if (items.get(index) instanceof ToolApprovalItem placeholder) {
                String identity = ApprovalIdentity.of(placeholder);
                if (wanted.remove(identity)) {
                    matched.put(identity, placeholder);
                }
            }
        }
        return matched;
    }

    /**
     * Keys of every call that already has a terminal result in history.
     */
    private static Set<String> completedCalls(List<RunItem> items) {
        Set<String> completed = new HashSet<>();
        for (RunItem item : items) {
            ModelItem raw = item.rawItem();
            if (raw == null) {
                continue;
            }
            switch (raw.kind()) {
            case FUNCTION_CALL_RESULT -> {
                addKey(completed, ActionKind.FUNCTION, raw.callId());
                addKey(completed, ActionKind.HANDOFF, raw.callId());
            }
            case COMPUTER_CALL_RESULT -> addKey(completed, ActionKind.COMPUTER, raw.callId());
            case SHELL_CALL_OUTPUT -> addKey(completed, ActionKind.SHELL, raw.callId());
            case APPLY_PATCH_CALL_OUTPUT -> addKey(completed, ActionKind.APPLY_PATCH, raw.callId());
            case HOSTED_TOOL_CALL -> {
                HostedToolCall hosted = (HostedToolCall) raw;
                if (HostedToolCall.MCP_APPROVAL_RESPONSE.equals(hosted.name()) && hosted.providerData() != null) {
                    Object requestId = hosted.providerData().get("approval_request_id");
                    addKey(completed, ActionKind.MCP_APPROVAL, requestId != null ? requestId.toString() : null);
                }
            }
            default -> {
            }
            }
        }
        return completed;
    }

    private static void addKey(Set<String> keys, ActionKind kind, String callId) {
        if (callId != null) {
            keys.add(key(kind, callId));
        }
    }

    /**
     * Calls without an id never match a result.
     */
    private static String key(ActionKind kind, String callId) {
        return callId == null ? null : kind + ":" + callId;
    }
}
