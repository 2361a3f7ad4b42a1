package me.golemcore.turns.domain.model.step;

import me.golemcore.turns.domain.model.item.ToolApprovalItem;

import java.util.List;

/**
 * The turn waits on approvals. Resumable with the same processed response once
 * decisions are recorded.
 */
public record Interruption(List<ToolApprovalItem> pendingApprovals) implements NextStep {

    public Interruption {
        pendingApprovals = List.copyOf(pendingApprovals);
    }

    @Override
    public Kind kind() {
        return Kind.INTERRUPTION;
    }
}
