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

import me.golemcore.turns.domain.model.RunContext;

import java.util.concurrent.CompletableFuture;

/**
 * Decides whether one call of a tool must be approved before it runs.
 *
 * @param <T>
 *            the call payload the decision looks at
 */
@FunctionalInterface
public interface ToolApprovalPolicy<T> {

    CompletableFuture<Boolean> needsApproval(RunContext context, T input, String callId);

    static <T> ToolApprovalPolicy<T> never() {
        return (context, input, callId) -> CompletableFuture.completedFuture(false);
    }

    static <T> ToolApprovalPolicy<T> always() {
        return (context, input, callId) -> CompletableFuture.completedFuture(true);
    }
}
