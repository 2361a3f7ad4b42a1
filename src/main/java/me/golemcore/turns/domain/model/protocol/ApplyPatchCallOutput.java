package me.golemcore.turns.domain.model.protocol;

public record ApplyPatchCallOutput(String callId, String status, String output) implements ModelItem {

    public static final String STATUS_COMPLETED = "completed";
    public static final String STATUS_FAILED = "failed";

    @Override
    public ModelItemKind kind() {
        return ModelItemKind.APPLY_PATCH_CALL_OUTPUT;
    }
}
