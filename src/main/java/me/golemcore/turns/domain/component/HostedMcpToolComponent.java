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
 * Remote MCP server whose tools the model provider calls on its side. The
 * provider asks for approval through {@code mcp_approval_request} entries.
 */
public interface HostedMcpToolComponent extends ToolComponent {

    String getServerLabel();

    @Override
    default String getToolName() {
        return getServerLabel();
    }

    @Override
    default ToolKind getToolKind() {
        return ToolKind.HOSTED_MCP;
    }

    /**
     * Returns the in-process approval resolver, or {@code null} when approval
     * requests must be answered by an external approver.
     */
    default ApprovalCallback getApprovalCallback() {
        return null;
    }
}
