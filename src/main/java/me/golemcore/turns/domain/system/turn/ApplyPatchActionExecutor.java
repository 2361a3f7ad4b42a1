package me.golemcore.turns.domain.system.turn;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.turns.domain.component.ApplyPatchEditor;
import me.golemcore.turns.domain.component.ApplyPatchToolComponent;
import me.golemcore.turns.domain.exception.RunCancelledException;
import me.golemcore.turns.domain.model.ApprovalDecision;
import me.golemcore.turns.domain.model.action.ApplyPatchToolAction;
import me.golemcore.turns.domain.model.item.ItemIds;
import me.golemcore.turns.domain.model.item.ToolCallOutputItem;
import me.golemcore.turns.domain.model.protocol.ApplyPatchCall;
import me.golemcore.turns.domain.model.protocol.ApplyPatchCallOutput;
import me.golemcore.turns.domain.model.protocol.ApplyPatchOperation;
import me.golemcore.turns.domain.service.RunEventService;

/**
 * Applies one patch operation through the tool's editor. Editor failures
 * yield a {@code failed} result carrying the error message.
 */
@Slf4j
public class ApplyPatchActionExecutor {

    private final ApprovalGate approvalGate;
    private final RunEventService runEventService;

    public ApplyPatchActionExecutor(ApprovalGate approvalGate, RunEventService runEventService) {
        this.approvalGate = approvalGate;
        this.runEventService = runEventService;
    }

    public ActionOutcome execute(DispatchContext context, ApplyPatchToolAction action) {
        ApplyPatchCall call = action.rawItem();
        ApplyPatchToolComponent tool = action.tool();

        ApprovalGate.ApprovalCheck approval = approvalGate.check(context, call, tool.getToolName(), call.callId(),
                tool.needsApproval(context.runContext(), call.operation(), call.callId()),
                tool.getApprovalCallback());
        if (approval.decision() == ApprovalDecision.UNDECIDED) {
            return ActionOutcome.pending(action.sequence(), approval.placeholder());
        }
        if (approval.decision() == ApprovalDecision.REJECTED) {
            return ActionOutcome.completed(action.sequence(), outputItem(context, new ApplyPatchCallOutput(
                    call.callId(), ApplyPatchCallOutput.STATUS_FAILED, FunctionToolExecutor.REJECTION_MESSAGE)));
        }

        runEventService.toolStarted(context.agent(), tool.getToolName(), call.callId());
        ApplyPatchCallOutput output;
        try {
            String message = apply(tool.getEditor(), call.operation());
            output = new ApplyPatchCallOutput(call.callId(), ApplyPatchCallOutput.STATUS_COMPLETED,
                    message != null ? message : "");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RunCancelledException("Interrupted during apply_patch call", e);
        } catch (Exception e) { // NOSONAR - editor failures are reported to the model
            log.error("[Dispatch] apply_patch {} failed: {}", call.callId(), e.getMessage());
            output = new ApplyPatchCallOutput(call.callId(), ApplyPatchCallOutput.STATUS_FAILED, Awaits.describe(e));
        }
        ToolCallOutputItem item = outputItem(context, output);
        runEventService.toolFinished(context.agent(), tool.getToolName(), call.callId(), item.output());
        return ActionOutcome.completed(action.sequence(), item);
    }

    private String apply(ApplyPatchEditor editor, ApplyPatchOperation operation) throws Exception {
        if (operation == null || operation.type() == null) {
            throw new IllegalArgumentException("apply_patch call without an operation");
        }
        return switch (operation.type()) {
        case CREATE_FILE -> editor.createFile(operation);
        case UPDATE_FILE -> editor.updateFile(operation);
        case DELETE_FILE -> editor.deleteFile(operation);
        };
    }

    private ToolCallOutputItem outputItem(DispatchContext context, ApplyPatchCallOutput output) {
        return new ToolCallOutputItem(ItemIds.generate(), context.agent().getName(), output, output.output());
    }
}
