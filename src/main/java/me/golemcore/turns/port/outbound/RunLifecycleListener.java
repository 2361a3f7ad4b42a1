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

import me.golemcore.turns.domain.model.RunEvent;

/**
 * Port for lifecycle observers. Registered as beans for run-level events, or
 * attached to an agent for that agent's events.
 */
public interface RunLifecycleListener {

    /**
     * Receives one lifecycle event. Called from dispatch threads; must be
     * thread-safe.
     *
     * @param event
     *            the emitted event
     */
    void onEvent(RunEvent event);
}
