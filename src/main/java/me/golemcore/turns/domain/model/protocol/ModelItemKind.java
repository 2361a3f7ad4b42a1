package me.golemcore.turns.domain.model.protocol;

/**
 * Discriminator of {@link ModelItem} variants, with the wire type name used in
 * approval identities and serialized snapshots.
 */
public enum ModelItemKind {
    MESSAGE("message"),
    REASONING("reasoning"),
    FUNCTION_CALL("function_call"),
    FUNCTION_CALL_RESULT("function_call_result"),
    COMPUTER_CALL("computer_call"),
    COMPUTER_CALL_RESULT("computer_call_result"),
    SHELL_CALL("shell_call"),
    SHELL_CALL_OUTPUT("shell_call_output"),
    APPLY_PATCH_CALL("apply_patch_call"),
    APPLY_PATCH_CALL_OUTPUT("apply_patch_call_output"),
    HOSTED_TOOL_CALL("hosted_tool_call"),
    UNKNOWN("unknown");

    private final String wireType;

    ModelItemKind(String wireType) {
        this.wireType = wireType;
    }

    public String wireType() {
        return wireType;
    }

    public boolean isToolResult() {
        return this == FUNCTION_CALL_RESULT || this == COMPUTER_CALL_RESULT || this == SHELL_CALL_OUTPUT
                || this == APPLY_PATCH_CALL_OUTPUT;
    }
}
