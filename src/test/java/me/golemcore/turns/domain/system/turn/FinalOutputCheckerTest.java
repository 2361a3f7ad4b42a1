package me.golemcore.turns.domain.system.turn;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.turns.domain.exception.ModelBehaviorException;
import me.golemcore.turns.domain.model.Agent;
import me.golemcore.turns.domain.service.JsonSchemaValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static me.golemcore.turns.testsupport.TurnEngineFixture.agent;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FinalOutputCheckerTest {

    private static final Map<String, Object> ANSWER_SCHEMA = Map.of(
            "type", "object",
            "properties", Map.of("answer", Map.of("type", "string")),
            "required", List.of("answer"),
            "additionalProperties", false);

    private FinalOutputChecker checker;
    private Agent structured;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        checker = new FinalOutputChecker(objectMapper, new JsonSchemaValidator(objectMapper), 40);
        structured = agent("structured");
        structured.setOutputSchema(ANSWER_SCHEMA);
    }

    @Test
    void shouldPassPlainTextThroughWithoutSchema() {
        assertEquals("not json", checker.check(agent("plain"), "not json"));
    }

    @Test
    void shouldAcceptConformingOutput() {
        assertEquals("{\"answer\":\"42\"}", checker.check(structured, "{\"answer\":\"42\"}"));
    }

    @Test
    void shouldRejectInvalidJson() {
        ModelBehaviorException error = assertThrows(ModelBehaviorException.class,
                () -> checker.check(structured, "answer: 42"));

        assertTrue(error.getMessage().startsWith(
                "Invalid output type: final assistant output failed schema validation at \"$\" (invalid JSON"));
    }

    @Test
    void shouldReportPathOfViolation() {
        ModelBehaviorException error = assertThrows(ModelBehaviorException.class,
                () -> checker.check(structured, "{\"answer\":42}"));

        assertEquals("Invalid output type: final assistant output failed schema validation at \"$.answer\" "
                + "(expected string but got integer).", error.getMessage());
        assertEquals("structured", error.getAgentName());
    }

    @Test
    void shouldTruncateLongDetails() {
        String truncated = checker.truncate("x".repeat(100));

        assertEquals(40, truncated.length());
        assertTrue(truncated.endsWith("..."));
        assertEquals("Schema validation failed.", checker.truncate(" "));
    }
}
