package me.golemcore.turns.domain.system.turn;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.turns.domain.component.FunctionTool;
import me.golemcore.turns.domain.component.Handoff;
import me.golemcore.turns.domain.exception.ModelBehaviorException;
import me.golemcore.turns.domain.model.Agent;
import me.golemcore.turns.domain.model.ModelResponse;
import me.golemcore.turns.domain.model.RunContext;
import me.golemcore.turns.domain.model.RunEventType;
import me.golemcore.turns.domain.model.ToolUseBehavior;
import me.golemcore.turns.domain.model.item.HandoffOutputItem;
import me.golemcore.turns.domain.model.item.MessageOutputItem;
import me.golemcore.turns.domain.model.item.RunItem;
import me.golemcore.turns.domain.model.item.ToolApprovalItem;
import me.golemcore.turns.domain.model.item.ToolCallItem;
import me.golemcore.turns.domain.model.item.ToolCallOutputItem;
import me.golemcore.turns.domain.model.protocol.ModelItem;
import me.golemcore.turns.domain.model.protocol.ModelMessage;
import me.golemcore.turns.domain.model.protocol.Reasoning;
import me.golemcore.turns.domain.model.step.FinalOutput;
import me.golemcore.turns.domain.model.step.HandoffStep;
import me.golemcore.turns.domain.model.step.Interruption;
import me.golemcore.turns.domain.model.step.NextStep;
import me.golemcore.turns.domain.model.step.RunAgain;
import me.golemcore.turns.domain.model.step.SingleStepResult;
import me.golemcore.turns.testsupport.TurnEngineFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static me.golemcore.turns.testsupport.TurnEngineFixture.agent;
import static me.golemcore.turns.testsupport.TurnEngineFixture.approvalTool;
import static me.golemcore.turns.testsupport.TurnEngineFixture.call;
import static me.golemcore.turns.testsupport.TurnEngineFixture.message;
import static me.golemcore.turns.testsupport.TurnEngineFixture.tool;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TurnResolverTest {

    private static final String RESPONSE_ID = "resp_1";
    private static final String LOOKUP = "lookup";
    private static final String DELETE = "delete_file";
    private static final String CALL_1 = "call_1";
    private static final String CALL_2 = "call_2";

    private TurnEngineFixture fixture;
    private TurnResolver resolver;
    private RunContext runContext;
    private AtomicInteger lookups;
    private AtomicInteger deletions;
    private FunctionTool lookupTool;
    private FunctionTool deleteTool;

    @BeforeEach
    void setUp() {
        fixture = new TurnEngineFixture();
        resolver = fixture.resolver();
        runContext = new RunContext();
        lookups = new AtomicInteger();
        deletions = new AtomicInteger();
        lookupTool = tool(LOOKUP, (context, arguments) -> "42 (" + lookups.incrementAndGet() + ")");
        deleteTool = approvalTool(DELETE, (context, arguments) -> "deleted (" + deletions.incrementAndGet() + ")");
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private ModelResponse response(ModelItem... output) {
        return new ModelResponse(RESPONSE_ID, List.of(output));
    }

    private TurnRequest.TurnRequestBuilder request(Agent agent, ModelResponse response) {
        return TurnRequest.builder()
                .agent(agent)
                .runContext(runContext)
                .originalInput(List.of(ModelMessage.user("hi")))
                .modelResponse(response)
                .processedResponse(fixture.classifier().classify(response, agent));
    }

    private SingleStepResult fresh(Agent agent, ModelResponse response) {
        return resolver.resolveTurnAfterModelResponse(request(agent, response).build());
    }

    private SingleStepResult resume(Agent agent, ModelResponse response, SingleStepResult interrupted,
            int persistedItemCount) {
        Interruption interruption = assertInstanceOf(Interruption.class, interrupted.nextStep());
        return resolver.resolveInterruptedTurn(request(agent, response)
                .preStepItems(interrupted.generatedItems())
                .persistedItemCount(persistedItemCount)
                .pendingApprovals(interruption.pendingApprovals())
                .build());
    }

    private long approvalEvents() {
        return fixture.events().stream().filter(event -> event.type() == RunEventType.APPROVAL_REQUESTED).count();
    }

    // ==================== Fresh turn ====================

    @Test
    void shouldFinishWhenResponseHasOnlyAssistantMessage() {
        SingleStepResult result = fresh(agent("assistant"), response(message("hello")));

        FinalOutput finalOutput = assertInstanceOf(FinalOutput.class, result.nextStep());
        assertEquals("hello", finalOutput.output());
        assertEquals(1, result.newStepItems().size());
        assertInstanceOf(MessageOutputItem.class, result.newStepItems().get(0));
    }

    @Test
    void shouldRunAgainAfterToolCall() {
        SingleStepResult result = fresh(agent("assistant", lookupTool), response(call(CALL_1, LOOKUP, "{}")));

        assertInstanceOf(RunAgain.class, result.nextStep());
        assertEquals(2, result.newStepItems().size());
        assertInstanceOf(ToolCallItem.class, result.newStepItems().get(0));
        ToolCallOutputItem output = assertInstanceOf(ToolCallOutputItem.class, result.newStepItems().get(1));
        assertEquals("42 (1)", output.output());
    }

    @Test
    void shouldRunAgainWhenToolRanEvenIfMessagePresent() {
        SingleStepResult result = fresh(agent("assistant", lookupTool),
                response(message("checking"), call(CALL_1, LOOKUP, "{}")));

        assertInstanceOf(RunAgain.class, result.nextStep());
    }

    @Test
    void shouldRunAgainWhenResponseHasNoMessage() {
        SingleStepResult result = fresh(agent("assistant"), response(new Reasoning("rs_1", "thinking")));

        assertInstanceOf(RunAgain.class, result.nextStep());
    }

    @Test
    void shouldUseLastMessageAsFinalOutput() {
        SingleStepResult result = fresh(agent("assistant"), response(message("first"), message("second")));

        assertEquals("second", assertInstanceOf(FinalOutput.class, result.nextStep()).output());
    }

    @Test
    void shouldFinishFromToolResultWhenBehaviorStopsOnFirstTool() {
        Agent agent = agent("assistant", lookupTool);
        agent.setToolUseBehavior(ToolUseBehavior.stopOnFirstTool());

        SingleStepResult result = fresh(agent, response(call(CALL_1, LOOKUP, "{}")));

        assertEquals("42 (1)", assertInstanceOf(FinalOutput.class, result.nextStep()).output());
    }

    @Test
    void shouldValidateStructuredFinalOutput() {
        Agent agent = agent("assistant");
        agent.setOutputSchema(Map.of("type", "object", "required", List.of("answer")));

        SingleStepResult result = fresh(agent, response(message("{\"answer\":\"yes\"}")));

        assertEquals("{\"answer\":\"yes\"}", assertInstanceOf(FinalOutput.class, result.nextStep()).output());
        assertThrows(ModelBehaviorException.class, () -> fresh(agent, response(message("{\"other\":1}"))));
    }

    @Test
    void shouldHandOffToRequestedAgent() {
        Agent billing = agent("Billing");
        Agent triage = agent("Triage");
        triage.getHandoffs().add(Handoff.to(billing));

        SingleStepResult result = fresh(triage, response(call(CALL_1, "transfer_to_billing", "{}")));

        HandoffStep step = assertInstanceOf(HandoffStep.class, result.nextStep());
        assertSame(billing, step.newAgent());
        HandoffOutputItem output = assertInstanceOf(HandoffOutputItem.class, result.newStepItems().get(1));
        assertEquals("{\"assistant\":\"Billing\"}", output.rawItem().output());
    }

    // ==================== Interruption ====================

    @Test
    void shouldInterruptWhenToolNeedsApproval() {
        SingleStepResult result = fresh(agent("assistant", deleteTool),
                response(call(CALL_1, DELETE, "{}"), message("done")));

        Interruption interruption = assertInstanceOf(Interruption.class, result.nextStep());
        assertEquals(1, interruption.pendingApprovals().size());
        assertEquals(DELETE, interruption.pendingApprovals().get(0).toolName());
        assertEquals(3, result.newStepItems().size());
        assertInstanceOf(ToolApprovalItem.class, result.newStepItems().get(2));
        assertEquals(0, deletions.get());
        assertEquals(1, approvalEvents());
    }

    @Test
    void shouldPreferInterruptionOverHandoff() {
        Agent billing = agent("Billing");
        Agent triage = agent("Triage", deleteTool);
        triage.getHandoffs().add(Handoff.to(billing));
        ModelResponse response = response(call(CALL_1, DELETE, "{}"), call(CALL_2, "transfer_to_billing", "{}"));

        SingleStepResult interrupted = fresh(triage, response);

        assertInstanceOf(Interruption.class, interrupted.nextStep());
        assertTrue(interrupted.newStepItems().stream().noneMatch(HandoffOutputItem.class::isInstance));

        Interruption interruption = (Interruption) interrupted.nextStep();
        runContext.approveTool(interruption.pendingApprovals().get(0));
        SingleStepResult resumed = resume(triage, response, interrupted, 0);

        assertSame(billing, assertInstanceOf(HandoffStep.class, resumed.nextStep()).newAgent());
        assertEquals(1, deletions.get());
        assertTrue(resumed.newStepItems().stream().anyMatch(HandoffOutputItem.class::isInstance));
    }

    // ==================== Resumption ====================

    @Test
    void shouldRunApprovedCallOnceAndRewindPersistedCount() {
        ModelResponse response = response(call(CALL_1, DELETE, "{}"));
        Agent agent = agent("assistant", deleteTool);
        SingleStepResult interrupted = fresh(agent, response);
        ToolApprovalItem placeholder = ((Interruption) interrupted.nextStep()).pendingApprovals().get(0);

        runContext.approveTool(placeholder);
        SingleStepResult resumed = resume(agent, response, interrupted, 2);

        assertInstanceOf(RunAgain.class, resumed.nextStep());
        assertEquals(1, resumed.persistedItemCount());
        assertEquals(1, resumed.preStepItems().size());
        assertInstanceOf(ToolCallItem.class, resumed.preStepItems().get(0));
        assertEquals(1, resumed.newStepItems().size());
        assertEquals("deleted (1)",
                assertInstanceOf(ToolCallOutputItem.class, resumed.newStepItems().get(0)).output());
        assertEquals(1, deletions.get());
    }

    @Test
    void shouldKeepSamePlaceholderWhenResumedWithoutDecision() {
        ModelResponse response = response(call(CALL_1, DELETE, "{}"));
        Agent agent = agent("assistant", deleteTool);
        SingleStepResult interrupted = fresh(agent, response);
        ToolApprovalItem placeholder = ((Interruption) interrupted.nextStep()).pendingApprovals().get(0);

        SingleStepResult resumed = resume(agent, response, interrupted, 2);

        Interruption again = assertInstanceOf(Interruption.class, resumed.nextStep());
        assertEquals(placeholder.id(), again.pendingApprovals().get(0).id());
        assertEquals(1, resumed.persistedItemCount());
        assertEquals(List.of(placeholder), resumed.newStepItems());
        assertEquals(2, resumed.generatedItems().size());
        assertEquals(1, approvalEvents());
        assertEquals(0, deletions.get());
    }

    @Test
    void shouldReportRejectionWhenApprovalDenied() {
        ModelResponse response = response(call(CALL_1, DELETE, "{}"));
        Agent agent = agent("assistant", deleteTool);
        SingleStepResult interrupted = fresh(agent, response);

        runContext.rejectTool(((Interruption) interrupted.nextStep()).pendingApprovals().get(0));
        SingleStepResult resumed = resume(agent, response, interrupted, 2);

        assertInstanceOf(RunAgain.class, resumed.nextStep());
        ToolCallOutputItem output = assertInstanceOf(ToolCallOutputItem.class, resumed.newStepItems().get(0));
        assertEquals(FunctionToolExecutor.REJECTION_MESSAGE, output.output());
        assertEquals(0, deletions.get());
    }

    @Test
    void shouldNotRerunCompletedCallsWhenResuming() {
        ModelResponse response = response(call(CALL_1, LOOKUP, "{}"), call(CALL_2, DELETE, "{}"));
        Agent agent = agent("assistant", lookupTool, deleteTool);
        SingleStepResult interrupted = fresh(agent, response);
        assertEquals(1, lookups.get());

        runContext.approveTool(((Interruption) interrupted.nextStep()).pendingApprovals().get(0));
        SingleStepResult resumed = resume(agent, response, interrupted, 0);

        assertEquals(1, lookups.get());
        assertEquals(1, deletions.get());
        assertEquals(1, resumed.newStepItems().size());
        assertEquals(CALL_2, resumed.newStepItems().get(0).rawItem().callId());
    }

    @Test
    void shouldFinishFromToolResultWhenResumedCallCompletes() {
        ModelResponse response = response(call(CALL_1, DELETE, "{}"));
        Agent agent = agent("assistant", deleteTool);
        agent.setToolUseBehavior(ToolUseBehavior.stopAtToolNames(DELETE));
        SingleStepResult interrupted = fresh(agent, response);

        runContext.approveTool(((Interruption) interrupted.nextStep()).pendingApprovals().get(0));
        SingleStepResult resumed = resume(agent, response, interrupted, 0);

        assertEquals("deleted (1)", assertInstanceOf(FinalOutput.class, resumed.nextStep()).output());
    }

    @Test
    void shouldReplayUncommittedTurnAfterCancellation() {
        ModelResponse response = response(call(CALL_1, LOOKUP, "{}"));
        Agent agent = agent("assistant", lookupTool);

        SingleStepResult resumed = resolver.resolveInterruptedTurn(request(agent, response).build());

        NextStep next = resumed.nextStep();
        assertInstanceOf(RunAgain.class, next);
        List<RunItem> items = resumed.newStepItems();
        assertEquals(2, items.size());
        assertInstanceOf(ToolCallItem.class, items.get(0));
        assertInstanceOf(ToolCallOutputItem.class, items.get(1));
        assertEquals(1, lookups.get());
    }
}
