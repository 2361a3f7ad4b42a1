package me.golemcore.turns.domain.system.turn;

import me.golemcore.turns.domain.model.FunctionToolResult;
import me.golemcore.turns.domain.model.item.RunItem;
import me.golemcore.turns.domain.model.item.ToolApprovalItem;

import java.util.List;

/**
 * What dispatching one action produced.
 *
 * @param items
 *            result items to append, in order
 * @param pendingApproval
 *            placeholder when the action waits on a decision, else
 *            {@code null}
 * @param functionResult
 *            function-call view for the tool use behavior, else {@code null}
 */
public record ActionOutcome(int sequence, List<RunItem> items, ToolApprovalItem pendingApproval,
        FunctionToolResult functionResult) {

    public ActionOutcome {
        items = List.copyOf(items);
    }

    static ActionOutcome completed(int sequence, RunItem item) {
        return new ActionOutcome(sequence, List.of(item), null, null);
    }

    static ActionOutcome pending(int sequence, ToolApprovalItem placeholder) {
        return new ActionOutcome(sequence, List.of(), placeholder, null);
    }

    static ActionOutcome function(int sequence, RunItem item, FunctionToolResult result) {
        return new ActionOutcome(sequence, List.of(item), null, result);
    }

    static ActionOutcome pendingFunction(int sequence, ToolApprovalItem placeholder, FunctionToolResult result) {
        return new ActionOutcome(sequence, List.of(), placeholder, result);
    }
}
