package me.golemcore.turns.domain.system.turn;

import me.golemcore.turns.domain.model.item.RunItem;
import me.golemcore.turns.domain.model.item.ToolApprovalItem;
import me.golemcore.turns.domain.service.ApprovalIdentity;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Single point of history mutation within one turn. Appends an item only if
 * neither its id nor, for approval placeholders, its approval identity is
 * already present in the inherited history or among items appended so far.
 */
class TurnHistoryWriter {

    private final Set<String> seenIds = new HashSet<>();
    private final Set<String> seenApprovals = new HashSet<>();
    private final List<RunItem> newItems = new ArrayList<>();

    TurnHistoryWriter(List<RunItem> inherited) {
        for (RunItem item : inherited) {
            remember(item);
        }
    }

    boolean append(RunItem item) {
        if (item == null || seenIds.contains(item.id())) {
            return false;
        }
        if (item instanceof ToolApprovalItem approval && seenApprovals.contains(ApprovalIdentity.of(approval))) {
            return false;
        }
        remember(item);
        newItems.add(item);
        return true;
    }

    List<RunItem> newItems() {
        return newItems;
    }

    private void remember(RunItem item) {
        seenIds.add(item.id());
        if (item instanceof ToolApprovalItem approval) {
            seenApprovals.add(ApprovalIdentity.of(approval));
        }
    }
}
