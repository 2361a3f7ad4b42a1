package me.golemcore.turns.domain.system.turn;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.turns.domain.component.Computer;
import me.golemcore.turns.domain.component.ComputerToolComponent;
import me.golemcore.turns.domain.exception.RunCancelledException;
import me.golemcore.turns.domain.model.ApprovalDecision;
import me.golemcore.turns.domain.model.action.ComputerToolAction;
import me.golemcore.turns.domain.model.item.ItemIds;
import me.golemcore.turns.domain.model.item.ToolCallOutputItem;
import me.golemcore.turns.domain.model.protocol.ComputerAction;
import me.golemcore.turns.domain.model.protocol.ComputerCall;
import me.golemcore.turns.domain.model.protocol.ComputerCallResult;
import me.golemcore.turns.domain.service.RunEventService;

import java.util.Locale;

/**
 * Performs one computer action and answers with the screenshot taken after it.
 * Driver failures produce an empty screenshot instead of aborting the turn.
 */
@Slf4j
public class ComputerActionExecutor {

    private static final String IMAGE_PREFIX = "data:image/png;base64,";

    private final ApprovalGate approvalGate;
    private final RunEventService runEventService;

    public ComputerActionExecutor(ApprovalGate approvalGate, RunEventService runEventService) {
        this.approvalGate = approvalGate;
        this.runEventService = runEventService;
    }

    public ActionOutcome execute(DispatchContext context, ComputerToolAction action) {
        ComputerCall call = action.rawItem();
        ComputerToolComponent tool = action.tool();
        String agentName = context.agent().getName();

        ApprovalGate.ApprovalCheck approval = approvalGate.check(context, call, tool.getToolName(), call.callId(),
                tool.needsApproval(context.runContext(), call.action(), call.callId()), null);
        if (approval.decision() == ApprovalDecision.UNDECIDED) {
            return ActionOutcome.pending(action.sequence(), approval.placeholder());
        }
        if (approval.decision() == ApprovalDecision.REJECTED) {
            return ActionOutcome.completed(action.sequence(), new ToolCallOutputItem(ItemIds.generate(), agentName,
                    new ComputerCallResult(call.callId(), ""), FunctionToolExecutor.REJECTION_MESSAGE));
        }

        runEventService.toolStarted(context.agent(), tool.getToolName(), call.callId());
        String imageUrl;
        try {
            String screenshot = perform(tool.getComputer(), call.action());
            imageUrl = IMAGE_PREFIX + screenshot;
        } catch (RunCancelledException e) {
            throw e;
        } catch (RuntimeException e) { // NOSONAR - driver failures are reported as an empty screenshot
            log.error("[Dispatch] computer action {} failed: {}", describe(call.action()), e.getMessage(), e);
            imageUrl = "";
        }
        if (Thread.currentThread().isInterrupted()) {
            throw new RunCancelledException("Interrupted during computer action");
        }
        runEventService.toolFinished(context.agent(), tool.getToolName(), call.callId(), imageUrl);
        return ActionOutcome.completed(action.sequence(), new ToolCallOutputItem(ItemIds.generate(), agentName,
                new ComputerCallResult(call.callId(), imageUrl), imageUrl));
    }

    private String perform(Computer computer, ComputerAction action) {
        switch (action.kind()) {
        case CLICK:
            ComputerAction.Click click = (ComputerAction.Click) action;
            computer.click(click.x(), click.y(), click.button());
            break;
        case DOUBLE_CLICK:
            ComputerAction.DoubleClick doubleClick = (ComputerAction.DoubleClick) action;
            computer.doubleClick(doubleClick.x(), doubleClick.y());
            break;
        case DRAG:
            computer.drag(((ComputerAction.Drag) action).path());
            break;
        case KEYPRESS:
            computer.keypress(((ComputerAction.Keypress) action).keys());
            break;
        case MOVE:
            ComputerAction.Move move = (ComputerAction.Move) action;
            computer.move(move.x(), move.y());
            break;
        case SCREENSHOT:
            return computer.screenshot();
        case SCROLL:
            ComputerAction.Scroll scroll = (ComputerAction.Scroll) action;
            computer.scroll(scroll.x(), scroll.y(), scroll.scrollX(), scroll.scrollY());
            break;
        case TYPE:
            computer.type(((ComputerAction.TypeText) action).text());
            break;
        case WAIT:
            computer.waitForUpdate();
            break;
        default:
            throw new IllegalArgumentException("Unsupported computer action: " + action.kind());
        }
        return computer.screenshot();
    }

    private String describe(ComputerAction action) {
        return action != null ? action.kind().name().toLowerCase(Locale.ROOT) : "none";
    }
}
