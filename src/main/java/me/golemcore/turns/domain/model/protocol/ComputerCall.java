package me.golemcore.turns.domain.model.protocol;

public record ComputerCall(String id, String callId, ComputerAction action, String status) implements ModelItem {

    @Override
    public ModelItemKind kind() {
        return ModelItemKind.COMPUTER_CALL;
    }
}
