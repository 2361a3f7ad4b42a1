package me.golemcore.turns.domain.loop;

import me.golemcore.turns.adapter.outbound.session.InMemorySessionAdapter;
import me.golemcore.turns.domain.component.Handoff;
import me.golemcore.turns.domain.exception.UserException;
import me.golemcore.turns.domain.model.Agent;
import me.golemcore.turns.domain.model.ApprovalDecision;
import me.golemcore.turns.domain.model.ModelResponse;
import me.golemcore.turns.domain.model.item.ToolApprovalItem;
import me.golemcore.turns.domain.model.protocol.ModelItem;
import me.golemcore.turns.domain.model.protocol.ModelMessage;
import me.golemcore.turns.infrastructure.config.TurnEngineConfiguration;
import me.golemcore.turns.infrastructure.config.TurnEngineProperties;
import me.golemcore.turns.port.outbound.ModelPort;
import me.golemcore.turns.testsupport.TurnEngineFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static me.golemcore.turns.testsupport.TurnEngineFixture.agent;
import static me.golemcore.turns.testsupport.TurnEngineFixture.approvalTool;
import static me.golemcore.turns.testsupport.TurnEngineFixture.call;
import static me.golemcore.turns.testsupport.TurnEngineFixture.message;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

class RunStateSerializerTest {

    private static final List<ModelItem> INPUT = List.of(ModelMessage.user("Publish the draft"));

    @Mock
    private ModelPort modelPort;

    private TurnEngineFixture fixture;
    private RunStateSerializer serializer;
    private AgentRunner runner;
    private AtomicInteger publications;
    private Agent publisher;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        fixture = new TurnEngineFixture();
        serializer = new RunStateSerializer(TurnEngineConfiguration.objectMapper(), fixture.classifier());
        runner = new AgentRunner(modelPort, new InMemorySessionAdapter(), fixture.classifier(), fixture.resolver(),
                fixture.runEventService(), new TurnEngineProperties());
        publications = new AtomicInteger();
        publisher = agent("publisher",
                approvalTool("publish", (context, arguments) -> "published " + publications.incrementAndGet()));
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private RunState pausedRun() {
        when(modelPort.getResponse(any(), any()))
                .thenReturn(CompletableFuture.completedFuture(
                        ModelResponse.of(List.of(call("call_1", "publish", "{\"draft\":7}")))))
                .thenReturn(CompletableFuture.completedFuture(ModelResponse.of(List.of(message("Published")))));
        RunResult paused = runner.run(publisher, INPUT, RunOptions.defaults());
        assertTrue(paused.isInterrupted());
        return paused.state();
    }

    // ==================== Round trip ====================

    @Test
    void shouldRestoreInterruptedRun() {
        RunState paused = pausedRun();
        paused.getRunContext().getApprovals().approve("other_tool", null, true);

        RunState restored = serializer.deserialize(serializer.serialize(paused), publisher);

        assertSame(publisher, restored.getCurrentAgent());
        assertTrue(restored.hasTurnInFlight());
        assertEquals(paused.getGeneratedItems(), restored.getGeneratedItems());
        assertEquals(paused.getOriginalInput(), restored.getOriginalInput());
        assertEquals(paused.getInterruptions(), restored.getInterruptions());
        assertEquals(paused.getPersistedItemCount(), restored.getPersistedItemCount());
        assertEquals(paused.getCurrentTurn(), restored.getCurrentTurn());
        assertEquals(paused.getLastProcessedResponse().newItems(), restored.getLastProcessedResponse().newItems());
        assertEquals(ApprovalDecision.APPROVED, restored.getRunContext().isToolApproved("other_tool", "any"));
        assertEquals(List.of("publish"), restored.getToolUseTracker().toolsUsedBy("publisher"));
    }

    @Test
    void shouldResumeRestoredRunAfterApproval() {
        RunState restored = serializer.deserialize(serializer.serialize(pausedRun()), publisher);
        ToolApprovalItem pending = restored.getInterruptions().get(0);

        restored.approve(pending);
        RunResult result = runner.resume(restored, RunOptions.defaults());

        assertEquals("Published", result.finalOutput());
        assertEquals(1, publications.get());
    }

    @Test
    void shouldRestoreFinishedRun() {
        when(modelPort.getResponse(any(), any()))
                .thenReturn(CompletableFuture.completedFuture(ModelResponse.of(List.of(message("Nothing to do")))));
        RunState finished = runner.run(publisher, INPUT, RunOptions.defaults()).state();

        RunState restored = serializer.deserialize(serializer.serialize(finished), publisher);

        assertTrue(restored.isFinished());
        assertThrows(UserException.class, () -> runner.resume(restored, RunOptions.defaults()));
    }

    // ==================== Agent resolution ====================

    @Test
    void shouldResolveAgentsReachableThroughHandoffs() {
        Agent triage = agent("triage");
        Agent billing = agent("billing");
        Agent refunds = agent("refunds");
        triage.getHandoffs().add(Handoff.to(billing));
        billing.getHandoffs().add(Handoff.to(refunds));
        refunds.getHandoffs().add(Handoff.to(triage));

        Map<String, Agent> agents = RunStateSerializer.reachableAgents(triage);

        assertEquals(List.of("triage", "billing", "refunds"), List.copyOf(agents.keySet()));
        assertSame(refunds, agents.get("refunds"));
    }

    @Test
    void shouldRejectUnknownAgent() {
        String json = serializer.serialize(pausedRun());

        assertThrows(UserException.class, () -> serializer.deserialize(json, agent("stranger")));
    }

    @Test
    void shouldRejectUnsupportedVersion() {
        String json = serializer.serialize(pausedRun()).replace("\"schemaVersion\":1", "\"schemaVersion\":99");

        UserException error = assertThrows(UserException.class, () -> serializer.deserialize(json, publisher));

        assertEquals("Unsupported run state version 99", error.getMessage());
    }

    @Test
    void shouldRejectMalformedJson() {
        assertThrows(UserException.class, () -> serializer.deserialize("{not json", publisher));
    }
}
