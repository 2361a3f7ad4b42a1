package me.golemcore.turns.domain.system.turn;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.turns.domain.exception.ModelBehaviorException;
import me.golemcore.turns.domain.model.Agent;
import me.golemcore.turns.domain.service.JsonSchemaValidator;

import java.util.List;

/**
 * Validates a provisional final output against the agent's output schema.
 * Agents without a schema accept any text.
 */
@Slf4j
public class FinalOutputChecker {

    private final ObjectMapper objectMapper;
    private final JsonSchemaValidator schemaValidator;
    private final int errorMaxLength;

    public FinalOutputChecker(ObjectMapper objectMapper, JsonSchemaValidator schemaValidator, int errorMaxLength) {
        this.objectMapper = objectMapper;
        this.schemaValidator = schemaValidator;
        this.errorMaxLength = errorMaxLength;
    }

    public String check(Agent agent, String output) {
        if (!agent.hasOutputSchema()) {
            return output;
        }
        JsonNode json;
        try {
            json = objectMapper.readTree(output);
        } catch (JsonProcessingException e) {
            throw failure(agent, "$", "invalid JSON: " + e.getOriginalMessage());
        }
        List<JsonSchemaValidator.Violation> violations = schemaValidator.validate(json, agent.getOutputSchema());
        if (!violations.isEmpty()) {
            JsonSchemaValidator.Violation first = violations.get(0);
            throw failure(agent, first.path(), first.message());
        }
        return output;
    }

    private ModelBehaviorException failure(Agent agent, String path, String message) {
        String detail = truncate(message);
        log.error("[Turn] final output of '{}' failed schema validation at {}: {}", agent.getName(), path, detail);
        return new ModelBehaviorException("Invalid output type: final assistant output failed schema validation at \""
                + path + "\" (" + detail + ").", agent.getName(), null);
    }

    String truncate(String message) {
        if (message == null || message.isBlank()) {
            return "Schema validation failed.";
        }
        if (message.length() <= errorMaxLength) {
            return message;
        }
        return message.substring(0, Math.max(0, errorMaxLength - 3)) + "...";
    }
}
