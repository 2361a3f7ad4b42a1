package me.golemcore.turns.domain.system.turn;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.turns.domain.component.ApprovalCallback;
import me.golemcore.turns.domain.model.ApprovalDecision;
import me.golemcore.turns.domain.model.ApprovalResponse;
import me.golemcore.turns.domain.model.RunContext;
import me.golemcore.turns.domain.model.item.ItemIds;
import me.golemcore.turns.domain.model.item.ToolApprovalItem;
import me.golemcore.turns.domain.model.protocol.ModelItem;

import java.util.concurrent.CompletableFuture;

/**
 * Resolves the approval state of one action: needs-approval policy first,
 * then the decision store, then an optional in-process callback.
 *
 * <p>
 * Only the callback path writes to the store, and it writes before the
 * decision is read back.
 */
@Slf4j
public class ApprovalGate {

    public ApprovalCheck check(DispatchContext context, ModelItem rawItem, String toolName, String callId,
            CompletableFuture<Boolean> needsApproval, ApprovalCallback callback) {
        boolean required = Boolean.TRUE.equals(Awaits.await(needsApproval, context.actionTimeout()));
        if (!required) {
            return new ApprovalCheck(ApprovalDecision.APPROVED, null);
        }

        RunContext runContext = context.runContext();
        ToolApprovalItem placeholder = new ToolApprovalItem(ItemIds.generate(), context.agent().getName(), rawItem,
                toolName);
        ApprovalDecision decision = runContext.isToolApproved(toolName, callId);
        if (decision == ApprovalDecision.UNDECIDED && callback != null) {
            ApprovalResponse response = Awaits.await(callback.onApproval(runContext, placeholder),
                    context.actionTimeout());
            if (response != null && response.approve()) {
                runContext.approveTool(placeholder);
            } else {
                runContext.rejectTool(placeholder);
            }
            decision = runContext.isToolApproved(toolName, callId);
            log.debug("[Approval] callback decided {} for '{}' ({})", decision, toolName, callId);
        }
        return new ApprovalCheck(decision, placeholder);
    }

    /**
     * @param placeholder
     *            approval item for the action; {@code null} when no approval was
     *            required
     */
    public record ApprovalCheck(ApprovalDecision decision, ToolApprovalItem placeholder) {
    }
}
