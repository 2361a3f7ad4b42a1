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

import me.golemcore.turns.domain.model.item.ToolApprovalItem;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Context handle passed explicitly through every tool, guardrail and handoff
 * call of a run. Owns the approval store, which persists across turns and
 * across snapshot resumption.
 */
public class RunContext {

    private final ToolApprovalStore approvals;
    private final Map<String, Object> attributes = new ConcurrentHashMap<>();

    public RunContext() {
        this(new ToolApprovalStore());
    }

    public RunContext(ToolApprovalStore approvals) {
        this.approvals = approvals != null ? approvals : new ToolApprovalStore();
    }

    public ToolApprovalStore getApprovals() {
        return approvals;
    }

    public ApprovalDecision isToolApproved(String toolName, String callId) {
        return approvals.isApproved(toolName, callId);
    }

    public void approveTool(ToolApprovalItem item) {
        approvals.approve(item, false);
    }

    public void approveTool(ToolApprovalItem item, boolean always) {
        approvals.approve(item, always);
    }

    public void rejectTool(ToolApprovalItem item) {
        approvals.reject(item, false);
    }

    public void rejectTool(ToolApprovalItem item, boolean always) {
        approvals.reject(item, always);
    }

    public void setAttribute(String key, Object value) {
        if (value == null) {
            attributes.remove(key);
            return;
        }
        attributes.put(key, value);
    }

    @SuppressWarnings("unchecked")
    public <T> T getAttribute(String key) {
        return (T) attributes.get(key);
    }
}
