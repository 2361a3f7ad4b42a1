package me.golemcore.turns.domain.model.protocol;

public record Reasoning(String id, String text) implements ModelItem {

    @Override
    public ModelItemKind kind() {
        return ModelItemKind.REASONING;
    }
}
