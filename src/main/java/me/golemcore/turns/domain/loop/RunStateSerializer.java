package me.golemcore.turns.domain.loop;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.turns.domain.component.Handoff;
import me.golemcore.turns.domain.exception.UserException;
import me.golemcore.turns.domain.model.Agent;
import me.golemcore.turns.domain.model.ModelResponse;
import me.golemcore.turns.domain.model.RunContext;
import me.golemcore.turns.domain.model.ToolApprovalStore;
import me.golemcore.turns.domain.model.ToolUseTracker;
import me.golemcore.turns.domain.model.item.RunItem;
import me.golemcore.turns.domain.model.item.ToolApprovalItem;
import me.golemcore.turns.domain.model.protocol.ModelItem;
import me.golemcore.turns.domain.model.step.FinalOutput;
import me.golemcore.turns.domain.model.step.HandoffStep;
import me.golemcore.turns.domain.model.step.Interruption;
import me.golemcore.turns.domain.model.step.NextStep;
import me.golemcore.turns.domain.model.step.RunAgain;
import me.golemcore.turns.domain.system.turn.ResponseClassifier;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON snapshots of {@link RunState}, so an interrupted run can wait for an
 * external approver outside the process.
 *
 * <p>
 * Agents are stored by name and resolved on restore against the agents
 * reachable from the starting agent through handoffs. The processed response
 * of an in-flight turn is not stored: it is classified again from the saved
 * model response, which yields the same item ids.
 */
@Component
@Slf4j
public class RunStateSerializer {

    static final int SCHEMA_VERSION = 1;

    private final ObjectMapper objectMapper;
    private final ResponseClassifier responseClassifier;

    public RunStateSerializer(ObjectMapper objectMapper, ResponseClassifier responseClassifier) {
        this.objectMapper = objectMapper;
        this.responseClassifier = responseClassifier;
    }

    public String serialize(RunState state) {
        NextStep step = state.getCurrentStep();
        Snapshot snapshot = new Snapshot(
                SCHEMA_VERSION,
                state.getCurrentAgent().getName(),
                state.getOriginalInput(),
                state.getGeneratedItems(),
                state.getLastModelResponse(),
                state.hasTurnInFlight(),
                step != null ? step.kind() : null,
                step instanceof FinalOutput finalOutput ? finalOutput.output() : null,
                state.getInterruptions(),
                state.getCurrentTurn(),
                state.getMaxTurns(),
                state.getPersistedItemCount(),
                state.getRunContext().getApprovals().snapshot(),
                state.getToolUseTracker().snapshot());
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize run state", e);
        }
    }

    public RunState deserialize(String json, Agent startingAgent) {
        Snapshot snapshot;
        try {
            snapshot = objectMapper.readValue(json, Snapshot.class);
        } catch (JsonProcessingException e) {
            throw new UserException("Invalid run state: " + e.getOriginalMessage());
        }
        if (snapshot.schemaVersion() != SCHEMA_VERSION) {
            throw new UserException("Unsupported run state version " + snapshot.schemaVersion());
        }

        Map<String, Agent> agents = reachableAgents(startingAgent);
        Agent current = agents.get(snapshot.currentAgent());
        if (current == null) {
            throw new UserException("Agent " + snapshot.currentAgent() + " not found from agent "
                    + startingAgent.getName());
        }

        RunState state = new RunState();
        state.setCurrentAgent(current);
        state.setRunContext(new RunContext(ToolApprovalStore.restore(snapshot.approvals())));
        state.setOriginalInput(new ArrayList<>(orEmpty(snapshot.originalInput())));
        state.setGeneratedItems(new ArrayList<>(orEmpty(snapshot.generatedItems())));
        state.setLastModelResponse(snapshot.lastModelResponse());
        state.setTurnInFlight(snapshot.turnInFlight());
        state.setCurrentStep(restoreStep(snapshot, current));
        state.setCurrentTurn(snapshot.currentTurn());
        state.setMaxTurns(snapshot.maxTurns());
        state.setPersistedItemCount(snapshot.persistedItemCount());
        state.setToolUseTracker(ToolUseTracker.restore(snapshot.toolUse()));
        if (state.hasTurnInFlight()) {
            state.setLastProcessedResponse(responseClassifier.classify(state.getLastModelResponse(), current));
        }
        log.debug("[Runner] restored run state of agent '{}' at turn {}", current.getName(),
                state.getCurrentTurn());
        return state;
    }

    private NextStep restoreStep(Snapshot snapshot, Agent current) {
        if (snapshot.currentStep() == null) {
            return null;
        }
        return switch (snapshot.currentStep()) {
        case RUN_AGAIN -> new RunAgain();
        case HANDOFF -> new HandoffStep(current);
        case FINAL_OUTPUT -> new FinalOutput(snapshot.finalOutput());
        case INTERRUPTION -> new Interruption(orEmpty(snapshot.interruptions()));
        };
    }

    static Map<String, Agent> reachableAgents(Agent start) {
        Map<String, Agent> agents = new LinkedHashMap<>();
        Deque<Agent> queue = new ArrayDeque<>();
        queue.add(start);
        while (!queue.isEmpty()) {
            Agent agent = queue.poll();
            if (agents.putIfAbsent(agent.getName(), agent) != null) {
                continue;
            }
            for (Handoff handoff : agent.getHandoffs()) {
                if (handoff.getAgent() != null) {
                    queue.add(handoff.getAgent());
                }
            }
        }
        return agents;
    }

    private static <T> List<T> orEmpty(List<T> items) {
        return items != null ? items : List.of();
    }

    /**
     * Serialized form of a run state.
     */
    public record Snapshot(
            int schemaVersion,
            String currentAgent,
            List<ModelItem> originalInput,
            List<RunItem> generatedItems,
            ModelResponse lastModelResponse,
            boolean turnInFlight,
            NextStep.Kind currentStep,
            String finalOutput,
            List<ToolApprovalItem> interruptions,
            int currentTurn,
            int maxTurns,
            int persistedItemCount,
            Map<String, ToolApprovalStore.Snapshot> approvals,
            Map<String, List<String>> toolUse) {
    }
}
