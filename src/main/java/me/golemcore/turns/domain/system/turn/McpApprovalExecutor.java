package me.golemcore.turns.domain.system.turn;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.turns.domain.component.ApprovalCallback;
import me.golemcore.turns.domain.model.ApprovalDecision;
import me.golemcore.turns.domain.model.ApprovalResponse;
import me.golemcore.turns.domain.model.RunContext;
import me.golemcore.turns.domain.model.action.McpApprovalAction;
import me.golemcore.turns.domain.model.item.ItemIds;
import me.golemcore.turns.domain.model.item.ToolCallItem;
import me.golemcore.turns.domain.model.protocol.HostedToolCall;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Answers remote approval requests. A recorded decision, or the server's
 * in-process callback, yields an {@code mcp_approval_response} item sent
 * upstream on the next model call; otherwise the request stays pending.
 */
@Slf4j
public class McpApprovalExecutor {

    public ActionOutcome execute(DispatchContext context, McpApprovalAction action) {
        RunContext runContext = context.runContext();
        String requestId = action.callId();
        ApprovalDecision decision = runContext.isToolApproved(action.toolName(), requestId);
        String reason = null;

        ApprovalCallback callback = action.tool().getApprovalCallback();
        if (decision == ApprovalDecision.UNDECIDED && callback != null) {
            ApprovalResponse response = Awaits.await(callback.onApproval(runContext, action.requestItem()),
                    context.actionTimeout());
            if (response != null && response.approve()) {
                runContext.approveTool(action.requestItem());
            } else {
                runContext.rejectTool(action.requestItem());
            }
            decision = runContext.isToolApproved(action.toolName(), requestId);
            reason = response != null ? response.reason() : null;
        }

        if (decision == ApprovalDecision.UNDECIDED) {
            log.debug("[Approval] MCP request {} on '{}' waits for an approver", requestId,
                    action.tool().getServerLabel());
            return ActionOutcome.pending(action.sequence(), action.requestItem());
        }

        Map<String, Object> providerData = new LinkedHashMap<>();
        providerData.put("approve", decision == ApprovalDecision.APPROVED);
        providerData.put("approval_request_id", requestId);
        if (reason != null) {
            providerData.put("reason", reason);
        }
        HostedToolCall response = new HostedToolCall(null, HostedToolCall.MCP_APPROVAL_RESPONSE, null, "completed",
                null, providerData);
        log.debug("[Approval] MCP request {} answered: {}", requestId, decision);
        return ActionOutcome.completed(action.sequence(),
                new ToolCallItem(ItemIds.generate(), context.agent().getName(), response));
    }
}
