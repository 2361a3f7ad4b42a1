package me.golemcore.turns.port.outbound;

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

import me.golemcore.turns.domain.model.Agent;
import me.golemcore.turns.domain.model.ModelResponse;
import me.golemcore.turns.domain.model.protocol.ModelItem;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the transport that obtains model responses. Implementations render
 * the agent's instructions, tools and handoffs into their own wire format.
 */
public interface ModelPort {

    /**
     * Requests the next response for an agent.
     *
     * @param agent
     *            the active agent
     * @param input
     *            full input history: run input followed by generated items
     * @return a future with the model response
     */
    CompletableFuture<ModelResponse> getResponse(Agent agent, List<ModelItem> input);
}
