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

/**
 * Base contract for every tool an agent can expose to the model. An agent
 * holds at most one computer, shell and apply-patch tool; function and hosted
 * MCP tools are looked up by name and server label.
 */
public interface ToolComponent {

    /**
     * Returns the name the model uses to call this tool. Approval decisions are
     * stored under this name.
     *
     * @return the tool name
     */
    String getToolName();

    ToolKind getToolKind();

    /**
     * Checks whether this tool is currently offered to the model. Disabled tools
     * are invisible to classification.
     *
     * @return true if the tool is enabled
     */
    default boolean isEnabled() {
        return true;
    }
}
