package me.golemcore.turns.domain.model;

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
import lombok.Setter;
import me.golemcore.turns.domain.component.Handoff;
import me.golemcore.turns.domain.component.ToolComponent;
import me.golemcore.turns.port.outbound.RunLifecycleListener;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Agent definition: the tools and handoffs it offers to the model and how its
 * final output is decided. Handoffs may form cycles, so identity is by
 * reference and the setters allow wiring after construction.
 */
@Getter
@Setter
@Builder
public class Agent {

    private String name;
    private String instructions;

    @Builder.Default
    private List<ToolComponent> tools = new ArrayList<>();

    @Builder.Default
    private List<Handoff> handoffs = new ArrayList<>();

    /** JSON Schema of a structured final output; {@code null} for plain text. */
    private Map<String, Object> outputSchema;

    @Builder.Default
    private ToolUseBehavior toolUseBehavior = ToolUseBehavior.runLlmAgain();

    /** Agent-level lifecycle observer, notified in addition to run-level ones. */
    private RunLifecycleListener listener;

    public boolean hasOutputSchema() {
        return outputSchema != null && !outputSchema.isEmpty();
    }

    @Override
    public String toString() {
        return "Agent(" + name + ")";
    }
}
