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
 * An approved function tool failed while running.
 */
public class ToolCallException extends AgentsException {

    private static final long serialVersionUID = 1L;

    private final String toolName;
    private final String callId;

    public ToolCallException(String toolName, String callId, Throwable cause) {
        super("Failed to run function tools: " + describe(cause), cause);
        this.toolName = toolName;
        this.callId = callId;
    }

    public String getToolName() {
        return toolName;
    }

    public String getCallId() {
        return callId;
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        return message != null ? message : cause.getClass().getSimpleName();
    }
}
