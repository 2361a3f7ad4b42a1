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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Validates JSON values against the subset of JSON Schema used by tool and
 * output definitions: {@code type}, {@code properties}, {@code required},
 * {@code additionalProperties: false}, {@code items} and {@code enum}.
 */
@Component
public class JsonSchemaValidator {

    private final ObjectMapper objectMapper;

    public JsonSchemaValidator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<Violation> validate(JsonNode value, Map<String, Object> schema) {
        List<Violation> violations = new ArrayList<>();
        if (schema != null) {
            validateNode(value, objectMapper.valueToTree(schema), "$", violations);
        }
        return violations;
    }

    private void validateNode(JsonNode value, JsonNode schema, String path, List<Violation> violations) {
        if (schema == null || !schema.isObject()) {
            return;
        }
        JsonNode type = schema.get("type");
        if (type != null && !matchesType(value, type)) {
            violations.add(new Violation(path, "expected " + describeType(type) + " but got " + nodeType(value)));
            return;
        }
        JsonNode allowed = schema.get("enum");
        if (allowed != null && allowed.isArray() && !contains(allowed, value)) {
            violations.add(new Violation(path, "value is not one of " + allowed));
            return;
        }
        if (value.isObject()) {
            validateObject(value, schema, path, violations);
        } else if (value.isArray() && schema.has("items")) {
            for (int i = 0; i < value.size(); i++) {
                validateNode(value.get(i), schema.get("items"), path + "[" + i + "]", violations);
            }
        }
    }

    private void validateObject(JsonNode value, JsonNode schema, String path, List<Violation> violations) {
        JsonNode required = schema.get("required");
        if (required != null && required.isArray()) {
            for (JsonNode field : required) {
                if (!value.has(field.asText())) {
                    violations.add(new Violation(path, "missing required property '" + field.asText() + "'"));
                }
            }
        }
        JsonNode properties = schema.get("properties");
        boolean closed = schema.has("additionalProperties") && schema.get("additionalProperties").isBoolean()
                && !schema.get("additionalProperties").asBoolean();
        Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode propertySchema = properties != null ? properties.get(field.getKey()) : null;
            if (propertySchema != null) {
                validateNode(field.getValue(), propertySchema, path + "." + field.getKey(), violations);
            } else if (closed) {
                violations.add(new Violation(path, "unexpected property '" + field.getKey() + "'"));
            }
        }
    }

    private boolean matchesType(JsonNode value, JsonNode type) {
        if (type.isArray()) {
            for (JsonNode candidate : type) {
                if (matchesSingleType(value, candidate.asText())) {
                    return true;
                }
            }
            return false;
        }
        return matchesSingleType(value, type.asText());
    }

    private boolean matchesSingleType(JsonNode value, String type) {
        return switch (type) {
        case "object" -> value.isObject();
        case "array" -> value.isArray();
        case "string" -> value.isTextual();
        case "integer" -> isInteger(value);
        case "number" -> value.isNumber();
        case "boolean" -> value.isBoolean();
        case "null" -> value.isNull();
        default -> true;
        };
    }

    private boolean contains(JsonNode allowed, JsonNode value) {
        for (JsonNode candidate : allowed) {
            if (candidate.equals(value)) {
                return true;
            }
        }
        return false;
    }

    private String describeType(JsonNode type) {
        return type.isArray() ? type.toString() : type.asText();
    }

    /**
     * Integral numbers and numbers with a zero fraction such as {@code 1.0}.
     */
    private boolean isInteger(JsonNode value) {
        return value.isIntegralNumber()
                || (value.isNumber() && value.decimalValue().stripTrailingZeros().scale() <= 0);
    }

    private String nodeType(JsonNode value) {
        if (isInteger(value)) {
            return "integer";
        }
        return value.getNodeType().name().toLowerCase(Locale.ROOT);
    }

    /**
     * One schema violation.
     *
     * @param path
     *            JSON path of the offending value, rooted at {@code $}
     * @param message
     *            what is wrong
     */
    public record Violation(String path, String message) {
    }
}
