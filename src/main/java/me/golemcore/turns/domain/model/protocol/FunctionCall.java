package me.golemcore.turns.domain.model.protocol;

import lombok.Builder;

/**
 * Function call requested by the model. Also the wire shape of handoff calls,
 * which the model sees as ordinary functions.
 */
@Builder
public record FunctionCall(String id, String callId, String name, String arguments, String status) implements ModelItem {

    @Override
    public ModelItemKind kind() {
        return ModelItemKind.FUNCTION_CALL;
    }
}
