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

import me.golemcore.turns.domain.model.protocol.ModelItem;

import java.util.List;
import java.util.UUID;

/**
 * One response obtained from the model: its ordered output entries.
 *
 * @param responseId
 *            provider response id; assigned locally when the provider has none
 * @param output
 *            output entries in emission order
 */
public record ModelResponse(String responseId, List<ModelItem> output) {

    public ModelResponse {
        output = output != null ? List.copyOf(output) : List.of();
    }

    public static ModelResponse of(List<ModelItem> output) {
        return new ModelResponse(null, output);
    }

    public ModelResponse withResponseIdIfMissing() {
        if (responseId != null && !responseId.isBlank()) {
            return this;
        }
        return new ModelResponse("resp_" + UUID.randomUUID(), output);
    }
}
