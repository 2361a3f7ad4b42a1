package me.golemcore.turns.domain.system.turn;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.turns.domain.component.FunctionTool;
import me.golemcore.turns.domain.component.GuardrailOutput;
import me.golemcore.turns.domain.component.ToolApprovalPolicy;
import me.golemcore.turns.domain.component.ToolInputGuardrail;
import me.golemcore.turns.domain.component.ToolOutputGuardrail;
import me.golemcore.turns.domain.exception.ToolInputGuardrailTripwireException;
import me.golemcore.turns.domain.exception.ToolOutputGuardrailTripwireException;
import me.golemcore.turns.domain.model.Agent;
import me.golemcore.turns.domain.model.CancellationToken;
import me.golemcore.turns.domain.model.RunContext;
import me.golemcore.turns.domain.model.RunEvent;
import me.golemcore.turns.domain.model.RunEventType;
import me.golemcore.turns.domain.model.ToolArguments;
import me.golemcore.turns.domain.model.ToolDefinition;
import me.golemcore.turns.domain.model.action.FunctionToolAction;
import me.golemcore.turns.domain.model.item.ToolCallOutputItem;
import me.golemcore.turns.domain.service.JsonSchemaValidator;
import me.golemcore.turns.domain.service.RunEventService;
import me.golemcore.turns.port.outbound.RunLifecycleListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

import static me.golemcore.turns.testsupport.TurnEngineFixture.agent;
import static me.golemcore.turns.testsupport.TurnEngineFixture.call;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

class FunctionToolExecutorTest {

    private static final String TOOL_NAME = "get_weather";
    private static final String CALL_ID = "call_w";
    private static final Map<String, Object> CITY_SCHEMA = Map.of(
            "type", "object",
            "properties", Map.of("city", Map.of("type", "string")),
            "required", List.of("city"));

    @Mock
    private ToolInputGuardrail inputGuardrail;

    @Mock
    private ToolOutputGuardrail outputGuardrail;

    private FunctionToolExecutor executor;
    private List<RunEvent> events;
    private RunContext runContext;
    private Agent agent;
    private AtomicReference<ToolArguments> received;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        ObjectMapper objectMapper = new ObjectMapper();
        events = new ArrayList<>();
        RunLifecycleListener recorder = events::add;
        executor = new FunctionToolExecutor(objectMapper, new JsonSchemaValidator(objectMapper), new ApprovalGate(),
                new RunEventService(Clock.systemUTC(), List.of(recorder)));
        runContext = new RunContext();
        agent = agent("forecaster");
        received = new AtomicReference<>();
        when(inputGuardrail.getName()).thenReturn("input-check");
        when(outputGuardrail.getName()).thenReturn("output-check");
    }

    private FunctionTool.FunctionToolBuilder weatherTool() {
        return FunctionTool.builder()
                .definition(ToolDefinition.builder().name(TOOL_NAME).description("Weather").inputSchema(CITY_SCHEMA)
                        .build())
                .handler((context, arguments) -> {
                    received.set(arguments);
                    return Map.of("city", arguments.text("city"), "forecast", "sunny");
                });
    }

    private ActionOutcome execute(FunctionTool tool, String arguments) {
        DispatchContext context = new DispatchContext(agent, runContext, new CancellationToken(), Duration.ofSeconds(5));
        return executor.execute(context, new FunctionToolAction(0, call(CALL_ID, TOOL_NAME, arguments), tool));
    }

    private static String output(ActionOutcome outcome) {
        return ((ToolCallOutputItem) outcome.items().get(0)).output();
    }

    // ==================== Invocation ====================

    @Test
    void shouldInvokeHandlerWithParsedArguments() {
        ActionOutcome outcome = execute(weatherTool().build(), "{\"city\":\"Oslo\"}");

        assertEquals("Oslo", received.get().text("city"));
        assertTrue(output(outcome).contains("\"forecast\":\"sunny\""));
        assertTrue(outcome.functionResult().executed());
        assertEquals(List.of(RunEventType.TOOL_STARTED, RunEventType.TOOL_FINISHED),
                events.stream().map(RunEvent::type).toList());
    }

    @Test
    void shouldPassRawTextWhenToolHasNoSchema() {
        FunctionTool tool = FunctionTool.builder()
                .definition(ToolDefinition.rawText(TOOL_NAME, "Free text"))
                .handler((context, arguments) -> {
                    received.set(arguments);
                    return "ok";
                })
                .build();

        execute(tool, "not json at all");

        assertEquals("not json at all", received.get().raw());
        assertNull(received.get().json());
    }

    @Test
    void shouldReportMalformedArgumentsWithoutInvoking() {
        ActionOutcome outcome = execute(weatherTool().build(), "{\"city\":");

        assertNull(received.get());
        assertTrue(output(outcome).startsWith("An error occurred while parsing tool arguments."));
        assertFalse(outcome.functionResult().executed());
        assertTrue(events.isEmpty());
    }

    @Test
    void shouldReportSchemaViolationWithoutInvoking() {
        ActionOutcome outcome = execute(weatherTool().build(), "{\"city\":7}");

        assertNull(received.get());
        assertTrue(output(outcome).endsWith("$.city: expected string but got integer"));
    }

    // ==================== Approval ====================

    @Test
    void shouldReturnPendingApprovalWhenUndecided() {
        ActionOutcome outcome = execute(weatherTool().approvalPolicy(ToolApprovalPolicy.always()).build(),
                "{\"city\":\"Oslo\"}");

        assertNotNull(outcome.pendingApproval());
        assertEquals(TOOL_NAME, outcome.pendingApproval().toolName());
        assertTrue(outcome.items().isEmpty());
        assertNull(received.get());
    }

    @Test
    void shouldRunWhenToolApprovedForAllCalls() {
        runContext.getApprovals().approve(TOOL_NAME, null, true);

        ActionOutcome outcome = execute(weatherTool().approvalPolicy(ToolApprovalPolicy.always()).build(),
                "{\"city\":\"Oslo\"}");

        assertNull(outcome.pendingApproval());
        assertNotNull(received.get());
    }

    @Test
    void shouldReturnRejectionMessageWhenRejected() {
        runContext.getApprovals().reject(TOOL_NAME, CALL_ID, false);

        ActionOutcome outcome = execute(weatherTool().approvalPolicy(ToolApprovalPolicy.always()).build(),
                "{\"city\":\"Oslo\"}");

        assertEquals(FunctionToolExecutor.REJECTION_MESSAGE, output(outcome));
        assertFalse(outcome.functionResult().executed());
    }

    // ==================== Guardrails ====================

    @Test
    void shouldReplaceInputWhenInputGuardrailRejects() {
        when(inputGuardrail.check(any(), anyString(), any(), any()))
                .thenReturn(CompletableFuture.completedFuture(GuardrailOutput.rejectContent("City not allowed")));

        ActionOutcome outcome = execute(weatherTool().inputGuardrails(List.of(inputGuardrail)).build(),
                "{\"city\":\"Oslo\"}");

        assertEquals("City not allowed", output(outcome));
        assertNull(received.get());
    }

    @Test
    void shouldEmitStartAndEndEventsWhenInputGuardrailRejects() {
        when(inputGuardrail.check(any(), anyString(), any(), any()))
                .thenReturn(CompletableFuture.completedFuture(GuardrailOutput.rejectContent("City not allowed")));

        execute(weatherTool().inputGuardrails(List.of(inputGuardrail)).build(), "{\"city\":\"Oslo\"}");

        assertEquals(List.of(RunEventType.TOOL_STARTED, RunEventType.TOOL_FINISHED),
                events.stream().map(RunEvent::type).toList());
        assertEquals(CALL_ID, events.get(1).callId());
        assertEquals("City not allowed", events.get(1).payload().get("output"));
    }

    @Test
    void shouldAbortWhenInputGuardrailTrips() {
        when(inputGuardrail.check(any(), anyString(), any(), any()))
                .thenReturn(CompletableFuture.completedFuture(GuardrailOutput.throwException(Map.of("risk", "high"))));

        ToolInputGuardrailTripwireException error = assertThrows(ToolInputGuardrailTripwireException.class,
                () -> execute(weatherTool().inputGuardrails(List.of(inputGuardrail)).build(), "{\"city\":\"Oslo\"}"));

        assertEquals("input-check", error.getGuardrailName());
        assertEquals(Map.of("risk", "high"), error.getOutputInfo());
    }

    @Test
    void shouldReplaceOutputWhenOutputGuardrailRejects() {
        when(outputGuardrail.check(any(), anyString(), any(), anyString()))
                .thenReturn(CompletableFuture.completedFuture(GuardrailOutput.rejectContent("[redacted]")));

        ActionOutcome outcome = execute(weatherTool().outputGuardrails(List.of(outputGuardrail)).build(),
                "{\"city\":\"Oslo\"}");

        assertNotNull(received.get());
        assertEquals("[redacted]", output(outcome));
    }

    @Test
    void shouldAbortWhenOutputGuardrailTrips() {
        when(outputGuardrail.check(any(), anyString(), any(), anyString()))
                .thenReturn(CompletableFuture.completedFuture(GuardrailOutput.throwException(null)));

        assertThrows(ToolOutputGuardrailTripwireException.class,
                () -> execute(weatherTool().outputGuardrails(List.of(outputGuardrail)).build(), "{\"city\":\"Oslo\"}"));
    }

    @Test
    void shouldContinueWhenGuardrailAllows() {
        when(inputGuardrail.check(any(), anyString(), any(), any()))
                .thenReturn(CompletableFuture.completedFuture(GuardrailOutput.allow()));

        execute(weatherTool().inputGuardrails(List.of(inputGuardrail)).build(), "{\"city\":\"Oslo\"}");

        assertNotNull(received.get());
    }
}
