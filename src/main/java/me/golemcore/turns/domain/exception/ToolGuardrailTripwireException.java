package me.golemcore.turns.domain.exception;

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

/**
 * A tool guardrail asked to abort the run.
 */
public abstract class ToolGuardrailTripwireException extends AgentsException {

    private static final long serialVersionUID = 1L;

    private final String guardrailName;
    private final String toolName;
    private final transient Map<String, Object> outputInfo;

    protected ToolGuardrailTripwireException(String message, String guardrailName, String toolName,
            Map<String, Object> outputInfo) {
        super(message);
        this.guardrailName = guardrailName;
        this.toolName = toolName;
        this.outputInfo = outputInfo != null ? Map.copyOf(outputInfo) : Map.of();
    }

    public String getGuardrailName() {
        return guardrailName;
    }

    public String getToolName() {
        return toolName;
    }

    public Map<String, Object> getOutputInfo() {
        return outputInfo;
    }
}
