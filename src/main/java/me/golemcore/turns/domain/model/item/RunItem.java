package me.golemcore.turns.domain.model.item;

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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import me.golemcore.turns.domain.model.protocol.ModelItem;

/**
 * Entry of the run-wide history log. Immutable; the log is append-only.
 *
 * <p>
 * Every item has a stable {@link #id()} assigned at creation. Deduplication
 * and "already seen" checks compare ids, never references, so they survive a
 * snapshot round trip.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "itemType")
@JsonSubTypes({
        @JsonSubTypes.Type(value = MessageOutputItem.class, name = "message_output_item"),
        @JsonSubTypes.Type(value = ToolCallItem.class, name = "tool_call_item"),
        @JsonSubTypes.Type(value = ToolCallOutputItem.class, name = "tool_call_output_item"),
        @JsonSubTypes.Type(value = ReasoningItem.class, name = "reasoning_item"),
        @JsonSubTypes.Type(value = HandoffCallItem.class, name = "handoff_call_item"),
        @JsonSubTypes.Type(value = HandoffOutputItem.class, name = "handoff_output_item"),
        @JsonSubTypes.Type(value = ToolApprovalItem.class, name = "tool_approval_item")
})
@JsonIgnoreProperties(ignoreUnknown = true)
public sealed interface RunItem permits MessageOutputItem, ToolCallItem, ToolCallOutputItem, ReasoningItem,
        HandoffCallItem, HandoffOutputItem, ToolApprovalItem {

    String id();

    /** Name of the agent that produced this item. */
    String agentName();

    ModelItem rawItem();

    RunItemKind kind();
}
