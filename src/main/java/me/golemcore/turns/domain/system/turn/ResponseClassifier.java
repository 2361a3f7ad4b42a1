package me.golemcore.turns.domain.system.turn;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.turns.domain.component.ApplyPatchToolComponent;
import me.golemcore.turns.domain.component.ComputerToolComponent;
import me.golemcore.turns.domain.component.FunctionToolComponent;
import me.golemcore.turns.domain.component.Handoff;
import me.golemcore.turns.domain.component.HostedMcpToolComponent;
import me.golemcore.turns.domain.component.ShellToolComponent;
import me.golemcore.turns.domain.component.ToolComponent;
import me.golemcore.turns.domain.exception.ModelBehaviorException;
import me.golemcore.turns.domain.model.Agent;
import me.golemcore.turns.domain.model.ModelResponse;
import me.golemcore.turns.domain.model.ProcessedResponse;
import me.golemcore.turns.domain.model.action.ApplyPatchToolAction;
import me.golemcore.turns.domain.model.action.ComputerToolAction;
import me.golemcore.turns.domain.model.action.FunctionToolAction;
import me.golemcore.turns.domain.model.action.HandoffAction;
import me.golemcore.turns.domain.model.action.McpApprovalAction;
import me.golemcore.turns.domain.model.action.ShellToolAction;
import me.golemcore.turns.domain.model.item.HandoffCallItem;
import me.golemcore.turns.domain.model.item.ItemIds;
import me.golemcore.turns.domain.model.item.MessageOutputItem;
import me.golemcore.turns.domain.model.item.ReasoningItem;
import me.golemcore.turns.domain.model.item.RunItem;
import me.golemcore.turns.domain.model.item.ToolApprovalItem;
import me.golemcore.turns.domain.model.item.ToolCallItem;
import me.golemcore.turns.domain.model.protocol.ApplyPatchCall;
import me.golemcore.turns.domain.model.protocol.ComputerCall;
import me.golemcore.turns.domain.model.protocol.FunctionCall;
import me.golemcore.turns.domain.model.protocol.HostedToolCall;
import me.golemcore.turns.domain.model.protocol.MessageRole;
import me.golemcore.turns.domain.model.protocol.ModelItem;
import me.golemcore.turns.domain.model.protocol.ModelMessage;
import me.golemcore.turns.domain.model.protocol.Reasoning;
import me.golemcore.turns.domain.model.protocol.ShellCall;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns one model response into history items and pending actions.
 *
 * <p>
 * Item ids are derived from the response id and the entry position, so
 * classifying the same response twice yields equal items. Any reference to a
 * tool, handoff or MCP server the agent does not offer fails the whole
 * response; nothing is returned for it.
 */
@Slf4j
public class ResponseClassifier {

    private static final String APPROVAL_SUFFIX = "_approval";

    public ProcessedResponse classify(ModelResponse response, Agent agent) {
        ModelResponse identified = response.withResponseIdIfMissing();
        Registry registry = new Registry(agent);
        Builder builder = new Builder();

        List<ModelItem> output = identified.output();
        for (int index = 0; index < output.size(); index++) {
            ModelItem entry = output.get(index);
            String itemId = ItemIds.forResponseEntry(identified.responseId(), index);
            switch (entry.kind()) {
            case MESSAGE -> classifyMessage(builder, agent, itemId, (ModelMessage) entry);
            case REASONING -> builder.items.add(new ReasoningItem(itemId, agent.getName(), (Reasoning) entry));
            case HOSTED_TOOL_CALL -> classifyHostedCall(builder, registry, agent, itemId, (HostedToolCall) entry,
                    index);
            case COMPUTER_CALL -> {
                ComputerToolComponent tool = require(registry.computer, agent,
                        "Model produced computer action without a computer tool.");
                builder.toolCall(agent, itemId, entry, tool);
                builder.computerActions.add(new ComputerToolAction(index, (ComputerCall) entry, tool));
            }
            case SHELL_CALL -> {
                ShellToolComponent tool = require(registry.shell, agent,
                        "Model produced shell action without a shell tool.");
                builder.toolCall(agent, itemId, entry, tool);
                builder.shellActions.add(new ShellToolAction(index, (ShellCall) entry, tool));
            }
            case APPLY_PATCH_CALL -> {
                ApplyPatchToolComponent tool = require(registry.applyPatch, agent,
                        "Model produced apply_patch action without an apply_patch tool.");
                builder.toolCall(agent, itemId, entry, tool);
                builder.applyPatchActions.add(new ApplyPatchToolAction(index, (ApplyPatchCall) entry, tool));
            }
            case FUNCTION_CALL -> classifyFunctionCall(builder, registry, agent, itemId, (FunctionCall) entry,
                    index);
            case FUNCTION_CALL_RESULT, COMPUTER_CALL_RESULT, SHELL_CALL_OUTPUT, APPLY_PATCH_CALL_OUTPUT, UNKNOWN ->
                log.debug("[Classifier] ignoring {} entry at position {}", entry.kind().wireType(), index);
            }
        }

        ProcessedResponse processed = builder.build();
        log.debug("[Classifier] agent '{}': {} item(s), tools used {}", agent.getName(),
                processed.newItems().size(), processed.toolsUsed());
        return processed;
    }

    private void classifyMessage(Builder builder, Agent agent, String itemId, ModelMessage message) {
        if (message.role() == MessageRole.ASSISTANT) {
            builder.items.add(new MessageOutputItem(itemId, agent.getName(), message));
        }
    }

    private void classifyHostedCall(Builder builder, Registry registry, Agent agent, String itemId,
            HostedToolCall call, int index) {
        builder.items.add(new ToolCallItem(itemId, agent.getName(), call));
        if (call.name() != null) {
            builder.toolsUsed.add(call.name());
        }
        if (!call.isMcpApprovalRequest()) {
            return;
        }

        String serverLabel = call.serverLabel();
        HostedMcpToolComponent server = serverLabel != null ? registry.mcpServers.get(serverLabel) : null;
        if (server == null) {
            throw new ModelBehaviorException(
                    "MCP server (" + serverLabel + ") not found in Agent (" + agent.getName() + ")",
                    agent.getName(), serverLabel);
        }

        Map<String, Object> providerData = call.providerData();
        String requestId = stringValue(providerData.get("id"), call.id());
        String requestedTool = stringValue(providerData.get("name"), call.name());
        HostedToolCall request = new HostedToolCall(requestId, requestedTool, call.arguments(), "in_progress", null,
                providerData);
        ToolApprovalItem placeholder = new ToolApprovalItem(itemId + APPROVAL_SUFFIX, agent.getName(), request,
                requestedTool);
        builder.mcpApprovalRequests.add(new McpApprovalAction(index, request, placeholder, server));
        if (server.getApprovalCallback() == null) {
            builder.items.add(placeholder);
        }
    }

    private void classifyFunctionCall(Builder builder, Registry registry, Agent agent, String itemId,
            FunctionCall call, int index) {
        builder.toolsUsed.add(call.name());
        Handoff handoff = registry.handoffs.get(call.name());
        if (handoff != null) {
            builder.items.add(new HandoffCallItem(itemId, agent.getName(), call));
            builder.handoffs.add(new HandoffAction(index, call, handoff));
            return;
        }
        FunctionToolComponent tool = registry.functions.get(call.name());
        if (tool == null) {
            throw new ModelBehaviorException("Tool " + call.name() + " not found in agent " + agent.getName() + ".",
                    agent.getName(), call.name());
        }
        builder.items.add(new ToolCallItem(itemId, agent.getName(), call));
        builder.functions.add(new FunctionToolAction(index, call, tool));
    }

    private static <T extends ToolComponent> T require(T tool, Agent agent, String message) {
        if (tool == null) {
            throw new ModelBehaviorException(message, agent.getName(), null);
        }
        return tool;
    }

    private static String stringValue(Object value, String fallback) {
        return value instanceof String text && !text.isBlank() ? text : fallback;
    }

    /**
     * Enabled tools and handoffs of one agent, indexed for lookup.
     */
    private static final class Registry {

        private final Map<String, Handoff> handoffs = new HashMap<>();
        private final Map<String, FunctionToolComponent> functions = new HashMap<>();
        private final Map<String, HostedMcpToolComponent> mcpServers = new HashMap<>();
        private ComputerToolComponent computer;
        private ShellToolComponent shell;
        private ApplyPatchToolComponent applyPatch;

        private Registry(Agent agent) {
            for (Handoff handoff : agent.getHandoffs()) {
                handoffs.putIfAbsent(handoff.getToolName(), handoff);
            }
            for (ToolComponent tool : agent.getTools()) {
                if (tool.isEnabled()) {
                    register(tool);
                }
            }
        }

        private void register(ToolComponent tool) {
            switch (tool.getToolKind()) {
            case FUNCTION -> functions.putIfAbsent(tool.getToolName(), (FunctionToolComponent) tool);
            case HOSTED_MCP -> {
                HostedMcpToolComponent server = (HostedMcpToolComponent) tool;
                mcpServers.putIfAbsent(server.getServerLabel(), server);
            }
            case COMPUTER -> computer = computer != null ? computer : (ComputerToolComponent) tool;
            case SHELL -> shell = shell != null ? shell : (ShellToolComponent) tool;
            case APPLY_PATCH -> applyPatch = applyPatch != null ? applyPatch : (ApplyPatchToolComponent) tool;
            }
        }
    }

    private static final class Builder {

        private final List<RunItem> items = new ArrayList<>();
        private final List<HandoffAction> handoffs = new ArrayList<>();
        private final List<FunctionToolAction> functions = new ArrayList<>();
        private final List<ComputerToolAction> computerActions = new ArrayList<>();
        private final List<ShellToolAction> shellActions = new ArrayList<>();
        private final List<ApplyPatchToolAction> applyPatchActions = new ArrayList<>();
        private final List<McpApprovalAction> mcpApprovalRequests = new ArrayList<>();
        private final List<String> toolsUsed = new ArrayList<>();

        private void toolCall(Agent agent, String itemId, ModelItem entry, ToolComponent tool) {
            items.add(new ToolCallItem(itemId, agent.getName(), entry));
            toolsUsed.add(tool.getToolName());
        }

        private ProcessedResponse build() {
            return new ProcessedResponse(items, handoffs, functions, computerActions, shellActions,
                    applyPatchActions, mcpApprovalRequests, toolsUsed);
        }
    }
}
