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

import me.golemcore.turns.domain.model.item.RunItem;

import java.util.List;

/**
 * The run was cancelled while a turn was in flight. When cancellation hit tool
 * dispatch, {@link #getGeneratedItems()} holds the turn's history including
 * the results of actions that had already completed, so a resume never runs
 * them again.
 */
public class RunCancelledException extends AgentsException {

    private static final long serialVersionUID = 1L;

    private final transient Object state;
    private final transient List<RunItem> generatedItems;

    public RunCancelledException(String message) {
        this(message, null, null, null);
    }

    public RunCancelledException(String message, Throwable cause) {
        this(message, cause, null, null);
    }

    private RunCancelledException(String message, Throwable cause, Object state, List<RunItem> generatedItems) {
        super(message, cause);
        this.state = state;
        this.generatedItems = generatedItems;
    }

    /**
     * Returns a copy of this exception carrying the resumable run state.
     */
    public RunCancelledException withState(Object runState) {
        RunCancelledException copy = new RunCancelledException(getMessage(), getCause(), runState, generatedItems);
        copy.setStackTrace(getStackTrace());
        return copy;
    }

    /**
     * Returns a copy of this exception carrying the history of the cancelled
     * turn.
     */
    public RunCancelledException withGeneratedItems(List<RunItem> items) {
        RunCancelledException copy = new RunCancelledException(getMessage(), getCause(), state, List.copyOf(items));
        copy.setStackTrace(getStackTrace());
        return copy;
    }

    @SuppressWarnings("unchecked")
    public <T> T getState() {
        return (T) state;
    }

    /**
     * History of the cancelled turn, or {@code null} when cancellation came
     * before dispatch.
     */
    public List<RunItem> getGeneratedItems() {
        return generatedItems;
    }
}
