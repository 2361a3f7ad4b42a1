package me.golemcore.turns.domain.service;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import me.golemcore.turns.domain.model.item.ToolApprovalItem;
import me.golemcore.turns.domain.model.protocol.ModelItem;

import java.util.Map;

/**
 * Derives the key that identifies an approval placeholder across resumptions,
 * independent of the placeholder's own item id.
 *
 * <p>
 * Preference order: {@code type:callId}, {@code type:id},
 * {@code type:provider:providerId}, then a structural key built from the
 * canonical JSON of the raw record.
 */
public final class ApprovalIdentity {

    private static final ObjectMapper CANONICAL_MAPPER = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    private ApprovalIdentity() {
    }

    public static String of(ToolApprovalItem item) {
        ModelItem raw = item.rawItem();
        String type = raw.kind().wireType();
        if (hasText(raw.callId())) {
            return type + ":" + raw.callId();
        }
        if (hasText(raw.id())) {
            return type + ":" + raw.id();
        }
        Map<String, Object> providerData = raw.providerData();
        if (providerData != null && providerData.get("id") instanceof String providerId && hasText(providerId)) {
            return type + ":provider:" + providerId;
        }
        return item.agentName() + ":" + type + ":" + canonicalJson(raw);
    }

    private static String canonicalJson(ModelItem raw) {
        try {
            return CANONICAL_MAPPER.writeValueAsString(raw);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot derive approval identity for " + raw.kind(), e);
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
