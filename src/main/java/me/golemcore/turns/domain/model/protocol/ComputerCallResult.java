package me.golemcore.turns.domain.model.protocol;

/**
 * Result of a computer action: the screenshot taken after the action, as a
 * {@code data:image/png;base64,...} URL. Empty when no screenshot is available.
 */
public record ComputerCallResult(String callId, String imageUrl) implements ModelItem {

    @Override
    public ModelItemKind kind() {
        return ModelItemKind.COMPUTER_CALL_RESULT;
    }
}
