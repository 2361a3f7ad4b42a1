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

import java.util.Map;

public record GuardrailOutput(GuardrailBehavior behavior, String message, Map<String, Object> outputInfo) {

    public static GuardrailOutput allow() {
        return new GuardrailOutput(GuardrailBehavior.ALLOW, null, Map.of());
    }

    public static GuardrailOutput rejectContent(String message) {
        return new GuardrailOutput(GuardrailBehavior.REJECT_CONTENT, message, Map.of());
    }

    public static GuardrailOutput throwException(Map<String, Object> outputInfo) {
        return new GuardrailOutput(GuardrailBehavior.THROW_EXCEPTION, null,
                outputInfo != null ? outputInfo : Map.of());
    }
}
