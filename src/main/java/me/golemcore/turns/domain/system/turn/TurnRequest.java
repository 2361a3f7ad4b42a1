package me.golemcore.turns.domain.system.turn;

import lombok.Builder;
import lombok.Getter;
import me.golemcore.turns.domain.component.HandoffInputFilter;
import me.golemcore.turns.domain.model.Agent;
import me.golemcore.turns.domain.model.CancellationToken;
import me.golemcore.turns.domain.model.ModelResponse;
import me.golemcore.turns.domain.model.ProcessedResponse;
import me.golemcore.turns.domain.model.RunContext;
import me.golemcore.turns.domain.model.item.RunItem;
import me.golemcore.turns.domain.model.item.ToolApprovalItem;
import me.golemcore.turns.domain.model.protocol.ModelItem;

import java.util.List;

/**
 * Input of one resolver invocation.
 */
@Getter
@Builder
public class TurnRequest {

    private final Agent agent;
    private final RunContext runContext;
    private final List<ModelItem> originalInput;

    /** History generated before this turn. */
    private final List<RunItem> preStepItems;

    private final ModelResponse modelResponse;
    private final ProcessedResponse processedResponse;

    /** Leading generated items already written to session storage. */
    private final int persistedItemCount;

    /**
     * Approvals the interrupted turn was waiting on. Only read when resuming.
     */
    private final List<ToolApprovalItem> pendingApprovals;

    private final CancellationToken cancellation;

    /** Run-level handoff input filter; a handoff's own filter wins. */
    private final HandoffInputFilter handoffInputFilter;

    public List<ModelItem> getOriginalInput() {
        return originalInput != null ? originalInput : List.of();
    }

    public List<RunItem> getPreStepItems() {
        return preStepItems != null ? preStepItems : List.of();
    }

    public List<ToolApprovalItem> getPendingApprovals() {
        return pendingApprovals != null ? pendingApprovals : List.of();
    }
}
