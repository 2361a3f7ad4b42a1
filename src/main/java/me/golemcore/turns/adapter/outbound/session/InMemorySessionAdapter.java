package me.golemcore.turns.adapter.outbound.session;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.turns.domain.model.protocol.ModelItem;
import me.golemcore.turns.port.outbound.SessionPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Session storage kept in memory, keyed by session id. Items of a session are
 * kept in append order.
 */
@Component
@Slf4j
public class InMemorySessionAdapter implements SessionPort {

    private final Map<String, List<ModelItem>> sessions = new ConcurrentHashMap<>();

    @Override
    public void addItems(String sessionId, List<ModelItem> items) {
        if (items == null || items.isEmpty()) {
            return;
        }
        sessions.computeIfAbsent(sessionId, id -> Collections.synchronizedList(new ArrayList<>())).addAll(items);
        log.debug("Session {}: appended {} item(s)", sessionId, items.size());
    }

    @Override
    public List<ModelItem> getItems(String sessionId) {
        List<ModelItem> items = sessions.get(sessionId);
        if (items == null) {
            return List.of();
        }
        synchronized (items) {
            return List.copyOf(items);
        }
    }

    @Override
    public void clear(String sessionId) {
        sessions.remove(sessionId);
    }
}
