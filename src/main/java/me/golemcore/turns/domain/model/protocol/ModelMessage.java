package me.golemcore.turns.domain.model.protocol;

import lombok.Builder;

/**
 * Conversational message. Input history carries user, system and developer
 * messages; model responses carry assistant messages.
 */
@Builder
public record ModelMessage(String id, MessageRole role, String text, String status) implements ModelItem {

    public static ModelMessage user(String text) {
        return new ModelMessage(null, MessageRole.USER, text, null);
    }

    public static ModelMessage assistant(String id, String text) {
        return new ModelMessage(id, MessageRole.ASSISTANT, text, "completed");
    }

    @Override
    public ModelItemKind kind() {
        return ModelItemKind.MESSAGE;
    }
}
