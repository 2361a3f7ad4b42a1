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

import me.golemcore.turns.domain.model.ApprovalResponse;
import me.golemcore.turns.domain.model.RunContext;
import me.golemcore.turns.domain.model.item.ToolApprovalItem;

import java.util.concurrent.CompletableFuture;

/**
 * Resolves an approval in-process, during dispatch, instead of interrupting
 * the run for an external approver.
 */
@FunctionalInterface
public interface ApprovalCallback {

    CompletableFuture<ApprovalResponse> onApproval(RunContext context, ToolApprovalItem approvalItem);
}
