package me.golemcore.turns.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.turns.domain.model.Agent;
import me.golemcore.turns.domain.model.RunEvent;
import me.golemcore.turns.domain.model.RunEventType;
import me.golemcore.turns.domain.model.item.ToolApprovalItem;
import me.golemcore.turns.port.outbound.RunLifecycleListener;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Emits lifecycle events to run-level listeners and to the listener of the
 * agent concerned.
 */
@Slf4j
public class RunEventService {

    private final Clock clock;
    private final List<RunLifecycleListener> listeners;

    public RunEventService(Clock clock, List<RunLifecycleListener> listeners) {
        this.clock = clock;
        this.listeners = listeners != null ? List.copyOf(listeners) : List.of();
    }

    public void agentStarted(Agent agent) {
        emit(agent, event(RunEventType.AGENT_STARTED, agent, null, null, Map.of()));
    }

    public void agentFinished(Agent agent, String output) {
        emit(agent, event(RunEventType.AGENT_FINISHED, agent, null, null, payload("output", output)));
    }

    public void toolStarted(Agent agent, String toolName, String callId) {
        emit(agent, event(RunEventType.TOOL_STARTED, agent, toolName, callId, Map.of()));
    }

    public void toolFinished(Agent agent, String toolName, String callId, String output) {
        emit(agent, event(RunEventType.TOOL_FINISHED, agent, toolName, callId, payload("output", output)));
    }

    public void toolFailed(Agent agent, String toolName, String callId, Throwable error) {
        emit(agent, event(RunEventType.TOOL_FINISHED, agent, toolName, callId,
                payload("error", String.valueOf(error))));
    }

    public void approvalRequested(Agent agent, ToolApprovalItem approvalItem) {
        emit(agent, event(RunEventType.APPROVAL_REQUESTED, agent, approvalItem.toolName(),
                approvalItem.rawItem().callId(), payload("approvalItemId", approvalItem.id())));
    }

    /**
     * Signals a handoff to run-level listeners and to the destination agent.
     */
    public void handoff(Agent from, Agent to) {
        RunEvent event = event(RunEventType.HANDOFF, to, null, null, payload("from", from.getName()));
        emit(to, event);
    }

    private void emit(Agent agent, RunEvent event) {
        for (RunLifecycleListener listener : listeners) {
            deliver(listener, event);
        }
        if (agent != null && agent.getListener() != null) {
            deliver(agent.getListener(), event);
        }
    }

    private void deliver(RunLifecycleListener listener, RunEvent event) {
        try {
            listener.onEvent(event);
        } catch (RuntimeException e) { // NOSONAR - a failing observer must not abort dispatch
            log.warn("[Lifecycle] listener failed on {}: {}", event.type(), e.getMessage());
        }
    }

    private RunEvent event(RunEventType type, Agent agent, String toolName, String callId,
            Map<String, Object> payload) {
        return RunEvent.builder()
                .type(type)
                .timestamp(Instant.now(clock))
                .agentName(agent != null ? agent.getName() : null)
                .toolName(toolName)
                .callId(callId)
                .payload(payload)
                .build();
    }

    private static Map<String, Object> payload(String key, Object value) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (value != null) {
            payload.put(key, value);
        }
        return payload;
    }
}
