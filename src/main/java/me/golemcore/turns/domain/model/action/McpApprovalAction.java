package me.golemcore.turns.domain.model.action;

import me.golemcore.turns.domain.component.HostedMcpToolComponent;
import me.golemcore.turns.domain.model.item.ToolApprovalItem;
import me.golemcore.turns.domain.model.protocol.HostedToolCall;

/**
 * Remote approval request from a hosted MCP server. {@code requestItem} is the
 * placeholder shown to external approvers; the request id is its key.
 */
public record McpApprovalAction(int sequence, HostedToolCall rawItem, ToolApprovalItem requestItem,
        HostedMcpToolComponent tool) implements ToolAction {

    @Override
    public ActionKind kind() {
        return ActionKind.MCP_APPROVAL;
    }

    @Override
    public String toolName() {
        return requestItem.toolName();
    }

    @Override
    public String callId() {
        return rawItem.id();
    }
}
