package me.golemcore.turns.domain.model;

import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * Structured lifecycle event emitted during turn execution.
 */
@Builder
public record RunEvent(RunEventType type, Instant timestamp, String agentName, String toolName, String callId,
        Map<String, Object> payload) {
}
