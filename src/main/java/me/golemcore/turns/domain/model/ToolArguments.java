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

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Function-tool arguments as sent by the model and, when the tool declares an
 * input schema, as parsed JSON.
 *
 * @param raw
 *            raw argument text
 * @param json
 *            parsed arguments, or {@code null} for tools without a schema
 */
public record ToolArguments(String raw, JsonNode json) {

    public static ToolArguments rawText(String raw) {
        return new ToolArguments(raw, null);
    }

    public String text(String field) {
        if (json == null || !json.hasNonNull(field)) {
            return null;
        }
        return json.get(field).asText();
    }
}
