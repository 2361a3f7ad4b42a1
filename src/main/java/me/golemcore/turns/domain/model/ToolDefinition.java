package me.golemcore.turns.domain.model;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Defines a function tool the model can call: name, description and the JSON
 * Schema its arguments are parsed against. A {@code null} schema means the
 * arguments are passed through as raw text.
 */
@Data
@Builder
public class ToolDefinition {

    private String name;
    private String description;
    private Map<String, Object> inputSchema; // JSON Schema

    /**
     * Creates a definition whose arguments are an object without declared
     * properties.
     */
    public static ToolDefinition simple(String name, String description) {
        return ToolDefinition.builder()
                .name(name)
                .description(description)
                .inputSchema(Map.of("type", "object", "properties", Map.of()))
                .build();
    }

    /**
     * Creates a definition whose arguments are not parsed.
     */
    public static ToolDefinition rawText(String name, String description) {
        return ToolDefinition.builder()
                .name(name)
                .description(description)
                .build();
    }
}
