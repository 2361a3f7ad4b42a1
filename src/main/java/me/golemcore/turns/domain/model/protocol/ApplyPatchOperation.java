package me.golemcore.turns.domain.model.protocol;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Single file operation requested by an apply-patch call. {@code diff} is
 * absent for deletions.
 */
public record ApplyPatchOperation(Type type, String path, String diff) {

    public enum Type {
        CREATE_FILE("create_file"), UPDATE_FILE("update_file"), DELETE_FILE("delete_file");

        private final String value;

        Type(String value) {
            this.value = value;
        }

        @JsonValue
        public String value() {
            return value;
        }
    }
}
