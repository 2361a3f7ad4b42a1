package me.golemcore.turns.domain.model;

import me.golemcore.turns.domain.model.action.ApplyPatchToolAction;
import me.golemcore.turns.domain.model.action.ComputerToolAction;
import me.golemcore.turns.domain.model.action.FunctionToolAction;
import me.golemcore.turns.domain.model.action.HandoffAction;
import me.golemcore.turns.domain.model.action.McpApprovalAction;
import me.golemcore.turns.domain.model.action.ShellToolAction;
import me.golemcore.turns.domain.model.action.ToolAction;
import me.golemcore.turns.domain.model.item.RunItem;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Classification of one model response: the history items it contributes and
 * the pending actions per kind.
 */
public record ProcessedResponse(List<RunItem> newItems, List<HandoffAction> handoffs,
        List<FunctionToolAction> functions, List<ComputerToolAction> computerActions,
        List<ShellToolAction> shellActions, List<ApplyPatchToolAction> applyPatchActions,
        List<McpApprovalAction> mcpApprovalRequests, List<String> toolsUsed) {

    public ProcessedResponse {
        newItems = List.copyOf(newItems);
        handoffs = List.copyOf(handoffs);
        functions = List.copyOf(functions);
        computerActions = List.copyOf(computerActions);
        shellActions = List.copyOf(shellActions);
        applyPatchActions = List.copyOf(applyPatchActions);
        mcpApprovalRequests = List.copyOf(mcpApprovalRequests);
        toolsUsed = List.copyOf(toolsUsed);
    }

    public boolean hasToolsOrApprovalsToRun() {
        return !handoffs.isEmpty() || !functions.isEmpty() || !computerActions.isEmpty()
                || !shellActions.isEmpty() || !applyPatchActions.isEmpty() || !mcpApprovalRequests.isEmpty();
    }

    /**
     * Every action except handoffs, in response order.
     */
    public List<ToolAction> dispatchableActions() {
        List<ToolAction> actions = new ArrayList<>();
        actions.addAll(functions);
        actions.addAll(computerActions);
        actions.addAll(shellActions);
        actions.addAll(applyPatchActions);
        actions.addAll(mcpApprovalRequests);
        actions.sort(Comparator.comparingInt(ToolAction::sequence));
        return actions;
    }
}
