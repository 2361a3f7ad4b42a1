package me.golemcore.turns.domain.model.protocol;

public record FunctionCallResult(String callId, String name, String output, String status) implements ModelItem {

    public static FunctionCallResult completed(FunctionCall call, String output) {
        return new FunctionCallResult(call.callId(), call.name(), output, "completed");
    }

    @Override
    public ModelItemKind kind() {
        return ModelItemKind.FUNCTION_CALL_RESULT;
    }
}
