package me.golemcore.turns.port.outbound;

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

import me.golemcore.turns.domain.model.protocol.ModelItem;

import java.util.List;

/**
 * Port for conversation storage. The run loop appends input and output items;
 * approval placeholders are never written.
 */
public interface SessionPort {

    void addItems(String sessionId, List<ModelItem> items);

    List<ModelItem> getItems(String sessionId);

    void clear(String sessionId);
}
