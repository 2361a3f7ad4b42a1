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

import java.util.UUID;

/**
 * Id generation for history items.
 */
public final class ItemIds {

    private ItemIds() {
    }

    public static String generate() {
        return "item_" + UUID.randomUUID();
    }

    /**
     * Deterministic id for the item derived from one entry of a model response.
     * Classifying the same response again yields the same ids, which lets a
     * restored snapshot recognize items it already holds.
     */
    public static String forResponseEntry(String responseId, int index) {
        return "item_" + responseId + "_" + index;
    }
}
