package me.golemcore.turns.domain.system.turn;

import me.golemcore.turns.domain.component.ApprovalCallback;
import me.golemcore.turns.domain.component.ComputerToolComponent;
import me.golemcore.turns.domain.component.FunctionTool;
import me.golemcore.turns.domain.component.Handoff;
import me.golemcore.turns.domain.component.HostedMcpToolComponent;
import me.golemcore.turns.domain.component.ShellToolComponent;
import me.golemcore.turns.domain.exception.ModelBehaviorException;
import me.golemcore.turns.domain.model.Agent;
import me.golemcore.turns.domain.model.ModelResponse;
import me.golemcore.turns.domain.model.ProcessedResponse;
import me.golemcore.turns.domain.model.ToolDefinition;
import me.golemcore.turns.domain.model.action.McpApprovalAction;
import me.golemcore.turns.domain.model.item.HandoffCallItem;
import me.golemcore.turns.domain.model.item.MessageOutputItem;
import me.golemcore.turns.domain.model.item.ReasoningItem;
import me.golemcore.turns.domain.model.item.ToolApprovalItem;
import me.golemcore.turns.domain.model.item.ToolCallItem;
import me.golemcore.turns.domain.model.protocol.ComputerAction;
import me.golemcore.turns.domain.model.protocol.ComputerCall;
import me.golemcore.turns.domain.model.protocol.HostedToolCall;
import me.golemcore.turns.domain.model.protocol.ModelItem;
import me.golemcore.turns.domain.model.protocol.ModelMessage;
import me.golemcore.turns.domain.model.protocol.Reasoning;
import me.golemcore.turns.domain.model.protocol.ShellCall;
import me.golemcore.turns.domain.model.protocol.UnknownEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static me.golemcore.turns.testsupport.TurnEngineFixture.agent;
import static me.golemcore.turns.testsupport.TurnEngineFixture.call;
import static me.golemcore.turns.testsupport.TurnEngineFixture.message;
import static me.golemcore.turns.testsupport.TurnEngineFixture.tool;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResponseClassifierTest {

    private static final String RESPONSE_ID = "resp_42";
    private static final String AGENT_NAME = "assistant";
    private static final String SERVER_LABEL = "docs";

    private ResponseClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new ResponseClassifier();
    }

    private static ModelResponse response(ModelItem... output) {
        return new ModelResponse(RESPONSE_ID, List.of(output));
    }

    private static HostedToolCall approvalRequest(String label) {
        return new HostedToolCall("mcpr_1", HostedToolCall.MCP_APPROVAL_REQUEST, "{\"q\":\"java\"}", null, null,
                Map.of("type", HostedToolCall.MCP_APPROVAL_REQUEST, "server_label", label, "id", "mcpr_1",
                        "name", "search_docs"));
    }

    // ==================== Messages ====================

    @Test
    void shouldKeepAssistantMessagesAndReasoning() {
        ProcessedResponse processed = classifier.classify(
                response(new Reasoning("rs_1", "plan"), ModelMessage.user("echo"), message("answer"),
                        new UnknownEntry("web_search_preview", Map.of())),
                agent(AGENT_NAME));

        assertEquals(2, processed.newItems().size());
        assertInstanceOf(ReasoningItem.class, processed.newItems().get(0));
        MessageOutputItem message = assertInstanceOf(MessageOutputItem.class, processed.newItems().get(1));
        assertEquals("answer", message.text());
        assertEquals(AGENT_NAME, message.agentName());
        assertFalse(processed.hasToolsOrApprovalsToRun());
    }

    @Test
    void shouldDeriveItemIdsFromResponseAndPosition() {
        Agent agent = agent(AGENT_NAME);
        ModelResponse response = response(new Reasoning("rs_1", "plan"), message("answer"));

        ProcessedResponse first = classifier.classify(response, agent);
        ProcessedResponse second = classifier.classify(response, agent);

        assertEquals("item_resp_42_1", first.newItems().get(1).id());
        assertEquals(first.newItems(), second.newItems());
    }

    @Test
    void shouldAssignResponseIdWhenMissing() {
        ProcessedResponse processed = classifier.classify(ModelResponse.of(List.of(message("hi"))),
                agent(AGENT_NAME));

        assertTrue(processed.newItems().get(0).id().startsWith("item_resp_"));
    }

    // ==================== Function calls and handoffs ====================

    @Test
    void shouldClassifyFunctionCall() {
        FunctionTool weather = tool("weather", (context, arguments) -> "sunny");

        ProcessedResponse processed = classifier.classify(response(call("call_1", "weather", "{}")),
                agent(AGENT_NAME, weather));

        assertEquals(1, processed.functions().size());
        assertEquals(weather, processed.functions().get(0).tool());
        assertInstanceOf(ToolCallItem.class, processed.newItems().get(0));
        assertEquals(List.of("weather"), processed.toolsUsed());
        assertTrue(processed.hasToolsOrApprovalsToRun());
    }

    @Test
    void shouldPreferHandoffOverFunctionWithSameName() {
        Agent billing = agent("Billing");
        Agent triage = agent("Triage", tool("transfer_to_billing", (context, arguments) -> "shadowed"));
        triage.getHandoffs().add(Handoff.to(billing));

        ProcessedResponse processed = classifier.classify(response(call("call_1", "transfer_to_billing", "{}")),
                triage);

        assertEquals(1, processed.handoffs().size());
        assertTrue(processed.functions().isEmpty());
        assertInstanceOf(HandoffCallItem.class, processed.newItems().get(0));
    }

    @Test
    void shouldFailWhenFunctionIsUnknown() {
        ModelBehaviorException error = assertThrows(ModelBehaviorException.class,
                () -> classifier.classify(response(call("call_1", "missing", "{}")), agent(AGENT_NAME)));

        assertEquals("Tool missing not found in agent assistant.", error.getMessage());
    }

    @Test
    void shouldIgnoreDisabledTools() {
        FunctionTool disabled = FunctionTool.builder()
                .definition(ToolDefinition.simple("weather", "disabled"))
                .handler((context, arguments) -> "sunny")
                .enabled(false)
                .build();

        assertThrows(ModelBehaviorException.class,
                () -> classifier.classify(response(call("call_1", "weather", "{}")), agent(AGENT_NAME, disabled)));
    }

    // ==================== Built-in tools ====================

    @Test
    void shouldFailWhenShellCallHasNoShellTool() {
        ShellCall shellCall = new ShellCall("sh_1", "call_sh", new ShellCall.Action(List.of("ls"), null, null),
                "completed");

        ModelBehaviorException error = assertThrows(ModelBehaviorException.class,
                () -> classifier.classify(response(shellCall), agent(AGENT_NAME)));

        assertEquals("Model produced shell action without a shell tool.", error.getMessage());
    }

    @Test
    void shouldClassifyShellAndComputerCalls() {
        ShellToolComponent shell = (context, action) -> new ShellToolComponent.ShellResult(List.of(), null);
        ComputerToolComponent computer = () -> null;
        ShellCall shellCall = new ShellCall("sh_1", "call_sh", new ShellCall.Action(List.of("ls"), null, null),
                "completed");
        ComputerCall computerCall = new ComputerCall("cu_1", "call_cu", new ComputerAction.Screenshot(),
                "completed");

        ProcessedResponse processed = classifier.classify(response(computerCall, shellCall),
                agent(AGENT_NAME, shell, computer));

        assertEquals(1, processed.shellActions().size());
        assertEquals(1, processed.computerActions().size());
        assertEquals(List.of("computer_use_preview", "shell"), processed.toolsUsed());
        assertEquals(0, processed.dispatchableActions().get(0).sequence());
    }

    // ==================== Hosted MCP ====================

    @Test
    void shouldAddPlaceholderForMcpRequestWithoutCallback() {
        HostedMcpToolComponent server = () -> SERVER_LABEL;

        ProcessedResponse processed = classifier.classify(response(approvalRequest(SERVER_LABEL)),
                agent(AGENT_NAME, server));

        assertEquals(2, processed.newItems().size());
        ToolApprovalItem placeholder = assertInstanceOf(ToolApprovalItem.class, processed.newItems().get(1));
        assertEquals("item_resp_42_0_approval", placeholder.id());
        assertEquals("search_docs", placeholder.toolName());
        McpApprovalAction action = processed.mcpApprovalRequests().get(0);
        assertEquals("mcpr_1", action.callId());
        assertEquals(placeholder, action.requestItem());
    }

    @Test
    void shouldNotAddPlaceholderWhenServerHasCallback() {
        HostedMcpToolComponent server = new HostedMcpToolComponent() {
            @Override
            public String getServerLabel() {
                return SERVER_LABEL;
            }

            @Override
            public ApprovalCallback getApprovalCallback() {
                return (context, item) -> CompletableFuture.completedFuture(null);
            }
        };

        ProcessedResponse processed = classifier.classify(response(approvalRequest(SERVER_LABEL)),
                agent(AGENT_NAME, server));

        assertEquals(1, processed.newItems().size());
        assertEquals(1, processed.mcpApprovalRequests().size());
    }

    @Test
    void shouldFailWhenMcpServerIsUnknown() {
        ModelBehaviorException error = assertThrows(ModelBehaviorException.class,
                () -> classifier.classify(response(approvalRequest("other")), agent(AGENT_NAME)));

        assertEquals("MCP server (other) not found in Agent (assistant)", error.getMessage());
    }

    @Test
    void shouldRecordPlainHostedCallAsToolCall() {
        HostedToolCall search = new HostedToolCall("ws_1", "web_search", null, "completed", "results", null);

        ProcessedResponse processed = classifier.classify(response(search), agent(AGENT_NAME));

        assertInstanceOf(ToolCallItem.class, processed.newItems().get(0));
        assertEquals(List.of("web_search"), processed.toolsUsed());
        assertFalse(processed.hasToolsOrApprovalsToRun());
    }
}
