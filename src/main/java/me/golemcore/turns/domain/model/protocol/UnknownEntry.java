package me.golemcore.turns.domain.model.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Entry of a type this engine does not know. Kept so transports can pass it
 * through; classification treats it as a no-op.
 */
public record UnknownEntry(@JsonProperty(value = "type", access = JsonProperty.Access.WRITE_ONLY) String originalType,
        Map<String, Object> payload) implements ModelItem {

    @Override
    public ModelItemKind kind() {
        return ModelItemKind.UNKNOWN;
    }
}
