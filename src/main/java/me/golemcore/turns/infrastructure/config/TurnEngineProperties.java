package me.golemcore.turns.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration of the turn engine, bound from the {@code turns.*} prefix.
 *
 * <ul>
 * <li>{@link RunnerProperties} - run loop limits</li>
 * <li>{@link DispatchProperties} - concurrent tool dispatch</li>
 * <li>{@link OutputProperties} - final output validation</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "turns")
@Data
public class TurnEngineProperties {

    private RunnerProperties runner = new RunnerProperties();
    private DispatchProperties dispatch = new DispatchProperties();
    private OutputProperties output = new OutputProperties();

    // ==================== RUNNER ====================

    @Data
    public static class RunnerProperties {
        /** Max number of model calls in one run before it aborts. */
        private int maxTurns = 10;
    }

    // ==================== DISPATCH ====================

    @Data
    public static class DispatchProperties {
        /**
         * Upper bound for each awaited tool handler, guardrail or approval
         * callback. Zero disables the bound.
         */
        private Duration actionTimeout = Duration.ofMinutes(5);

        /** Dispatch threads; 0 uses an unbounded cached pool. */
        private int poolSize = 0;
    }

    // ==================== OUTPUT ====================

    @Data
    public static class OutputProperties {
        private int schemaErrorMaxLength = 160;
    }
}
