package me.golemcore.turns.domain.system.turn;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.turns.domain.component.ShellToolComponent;
import me.golemcore.turns.domain.exception.RunCancelledException;
import me.golemcore.turns.domain.model.ApprovalDecision;
import me.golemcore.turns.domain.model.action.ShellToolAction;
import me.golemcore.turns.domain.model.item.ItemIds;
import me.golemcore.turns.domain.model.item.ToolCallOutputItem;
import me.golemcore.turns.domain.model.protocol.ShellCall;
import me.golemcore.turns.domain.model.protocol.ShellCallOutput;
import me.golemcore.turns.domain.service.RunEventService;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs one shell call. Shell failures are reported to the model as stderr.
 */
@Slf4j
public class ShellActionExecutor {

    private final ApprovalGate approvalGate;
    private final RunEventService runEventService;

    public ShellActionExecutor(ApprovalGate approvalGate, RunEventService runEventService) {
        this.approvalGate = approvalGate;
        this.runEventService = runEventService;
    }

    public ActionOutcome execute(DispatchContext context, ShellToolAction action) {
        ShellCall call = action.rawItem();
        ShellToolComponent tool = action.tool();

        ApprovalGate.ApprovalCheck approval = approvalGate.check(context, call, tool.getToolName(), call.callId(),
                tool.needsApproval(context.runContext(), call.action(), call.callId()), tool.getApprovalCallback());
        if (approval.decision() == ApprovalDecision.UNDECIDED) {
            return ActionOutcome.pending(action.sequence(), approval.placeholder());
        }
        if (approval.decision() == ApprovalDecision.REJECTED) {
            ShellCallOutput rejected = new ShellCallOutput(call.callId(), List.of(new ShellCallOutput.CommandOutput("",
                    FunctionToolExecutor.REJECTION_MESSAGE, ShellCallOutput.Outcome.exit(null))), null);
            return ActionOutcome.completed(action.sequence(), outputItem(context, rejected));
        }

        runEventService.toolStarted(context.agent(), tool.getToolName(), call.callId());
        ShellCallOutput output;
        try {
            ShellToolComponent.ShellResult result = tool.execute(context.runContext(), call.action());
            output = new ShellCallOutput(call.callId(), result != null ? result.output() : List.of(),
                    result != null ? result.maxOutputLength() : null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RunCancelledException("Interrupted during shell call", e);
        } catch (Exception e) { // NOSONAR - shell failures are reported to the model
            log.error("[Dispatch] shell call {} failed: {}", call.callId(), e.getMessage());
            output = new ShellCallOutput(call.callId(), List.of(new ShellCallOutput.CommandOutput("",
                    Awaits.describe(e), ShellCallOutput.Outcome.exit(1))), null);
        }
        ToolCallOutputItem item = outputItem(context, output);
        runEventService.toolFinished(context.agent(), tool.getToolName(), call.callId(), item.output());
        return ActionOutcome.completed(action.sequence(), item);
    }

    private ToolCallOutputItem outputItem(DispatchContext context, ShellCallOutput output) {
        return new ToolCallOutputItem(ItemIds.generate(), context.agent().getName(), output, render(output));
    }

    private String render(ShellCallOutput output) {
        if (output.output() == null) {
            return "";
        }
        return output.output().stream()
                .map(command -> join(command.stdout(), command.stderr()))
                .collect(Collectors.joining("\n"));
    }

    private String join(String stdout, String stderr) {
        boolean hasOut = stdout != null && !stdout.isEmpty();
        boolean hasErr = stderr != null && !stderr.isEmpty();
        if (hasOut && hasErr) {
            return stdout + "\n" + stderr;
        }
        return hasOut ? stdout : (hasErr ? stderr : "");
    }
}
