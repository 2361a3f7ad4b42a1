package me.golemcore.turns.domain.component;

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

import lombok.Builder;
import lombok.Getter;
import me.golemcore.turns.domain.model.Agent;
import me.golemcore.turns.domain.model.RunContext;

import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Transfer of control to another agent, offered to the model as a function.
 */
@Getter
@Builder
public class Handoff {

    private final Agent agent;
    private final String toolName;
    private final String toolDescription;
    private final HandoffInvoker invoker;
    private final HandoffInputFilter inputFilter;

    public static Handoff to(Agent agent) {
        return Handoff.builder().agent(agent).build();
    }

    public String getToolName() {
        if (toolName != null && !toolName.isBlank()) {
            return toolName;
        }
        return defaultToolName(Objects.requireNonNull(agent, "agent").getName());
    }

    public String getToolDescription() {
        if (toolDescription != null) {
            return toolDescription;
        }
        return "Handoff to the " + getAgentName() + " agent to handle the request.";
    }

    public String getAgentName() {
        return agent != null ? agent.getName() : null;
    }

    public CompletableFuture<Agent> invoke(RunContext context, String arguments) {
        if (invoker != null) {
            return invoker.onInvoke(context, arguments);
        }
        return CompletableFuture.completedFuture(agent);
    }

    static String defaultToolName(String agentName) {
        String snake = agentName.trim()
                .replaceAll("([a-z0-9])([A-Z])", "$1_$2")
                .replaceAll("[^A-Za-z0-9]+", "_")
                .toLowerCase(Locale.ROOT);
        return "transfer_to_" + snake.replaceAll("^_+|_+$", "");
    }
}
