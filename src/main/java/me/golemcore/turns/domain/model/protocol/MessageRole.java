package me.golemcore.turns.domain.model.protocol;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MessageRole {
    SYSTEM("system"), DEVELOPER("developer"), USER("user"), ASSISTANT("assistant");

    private final String value;

    MessageRole(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
