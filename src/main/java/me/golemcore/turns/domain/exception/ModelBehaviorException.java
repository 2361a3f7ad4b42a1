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

/**
 * The model produced something the registered agent cannot act on: an unknown
 * tool, handoff or MCP server, a tool kind the agent lacks, or a final output
 * that fails its schema. Deterministic; never retried.
 */
public class ModelBehaviorException extends AgentsException {

    private static final long serialVersionUID = 1L;

    private final String agentName;
    private final String toolName;

    public ModelBehaviorException(String message, String agentName, String toolName) {
        super(message);
        this.agentName = agentName;
        this.toolName = toolName;
    }

    public String getAgentName() {
        return agentName;
    }

    public String getToolName() {
        return toolName;
    }
}
