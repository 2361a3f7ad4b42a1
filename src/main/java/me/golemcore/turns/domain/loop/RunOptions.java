package me.golemcore.turns.domain.loop;

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

import lombok.Builder;
import lombok.Getter;
import me.golemcore.turns.domain.component.HandoffInputFilter;
import me.golemcore.turns.domain.model.CancellationToken;
import me.golemcore.turns.domain.model.RunContext;

/**
 * Per-run settings. Every field is optional.
 */
@Getter
@Builder
public class RunOptions {

    /** Session the run's items are written to; {@code null} skips persistence. */
    private final String sessionId;

    @Builder.Default
    private final CancellationToken cancellation = new CancellationToken();

    /** Applied to handoffs that declare no filter of their own. */
    private final HandoffInputFilter handoffInputFilter;

    /** Overrides {@code turns.runner.max-turns} for new runs. */
    private final Integer maxTurns;

    /** Context of a new run; ignored when resuming. */
    private final RunContext runContext;

    public static RunOptions defaults() {
        return RunOptions.builder().build();
    }
}
