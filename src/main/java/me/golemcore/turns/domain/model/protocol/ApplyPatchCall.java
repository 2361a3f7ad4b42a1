package me.golemcore.turns.domain.model.protocol;

public record ApplyPatchCall(String id, String callId, ApplyPatchOperation operation, String status) implements ModelItem {

    @Override
    public ModelItemKind kind() {
        return ModelItemKind.APPLY_PATCH_CALL;
    }
}
