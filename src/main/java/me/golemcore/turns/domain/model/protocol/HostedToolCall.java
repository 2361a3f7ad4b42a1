package me.golemcore.turns.domain.model.protocol;

import java.util.Map;

/**
 * Call executed by the model provider on its side (hosted tools, remote MCP
 * servers). Remote approval requests and the responses sent back for them use
 * this shape too; {@code providerData.type} tells them apart.
 */
public record HostedToolCall(String id, String name, String arguments, String status, String output,
        Map<String, Object> providerData) implements ModelItem {

    public static final String MCP_APPROVAL_REQUEST = "mcp_approval_request";
    public static final String MCP_APPROVAL_RESPONSE = "mcp_approval_response";

    public boolean isMcpApprovalRequest() {
        Object type = providerData != null ? providerData.get("type") : null;
        return MCP_APPROVAL_REQUEST.equals(type) || MCP_APPROVAL_REQUEST.equals(name);
    }

    public String serverLabel() {
        Object label = providerData != null ? providerData.get("server_label") : null;
        return label instanceof String value ? value : null;
    }

    @Override
    public ModelItemKind kind() {
        return ModelItemKind.HOSTED_TOOL_CALL;
    }
}
