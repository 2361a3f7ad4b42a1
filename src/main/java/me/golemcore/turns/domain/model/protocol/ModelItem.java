package me.golemcore.turns.domain.model.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Map;

/**
 * Raw record exchanged with the model: one entry of a model response, one entry
 * of the input history, or one tool result sent back upstream.
 *
 * <p>
 * The set of variants is closed. Entries whose type the transport does not
 * recognize are carried as {@link UnknownEntry} and ignored by classification.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type", visible = true, defaultImpl = UnknownEntry.class)
@JsonSubTypes({
        @JsonSubTypes.Type(value = ModelMessage.class, name = "message"),
        @JsonSubTypes.Type(value = Reasoning.class, name = "reasoning"),
        @JsonSubTypes.Type(value = FunctionCall.class, name = "function_call"),
        @JsonSubTypes.Type(value = FunctionCallResult.class, name = "function_call_result"),
        @JsonSubTypes.Type(value = ComputerCall.class, name = "computer_call"),
        @JsonSubTypes.Type(value = ComputerCallResult.class, name = "computer_call_result"),
        @JsonSubTypes.Type(value = ShellCall.class, name = "shell_call"),
        @JsonSubTypes.Type(value = ShellCallOutput.class, name = "shell_call_output"),
        @JsonSubTypes.Type(value = ApplyPatchCall.class, name = "apply_patch_call"),
        @JsonSubTypes.Type(value = ApplyPatchCallOutput.class, name = "apply_patch_call_output"),
        @JsonSubTypes.Type(value = HostedToolCall.class, name = "hosted_tool_call"),
        @JsonSubTypes.Type(value = UnknownEntry.class, name = "unknown")
})
@JsonIgnoreProperties(ignoreUnknown = true)
public sealed interface ModelItem permits ModelMessage, Reasoning, FunctionCall, FunctionCallResult, ComputerCall,
        ComputerCallResult, ShellCall, ShellCallOutput, ApplyPatchCall, ApplyPatchCallOutput, HostedToolCall,
        UnknownEntry {

    ModelItemKind kind();

    /** Item id assigned by the model, when the variant carries one. */
    default String id() {
        return null;
    }

    /** Call id correlating a tool call with its result, when the variant carries one. */
    default String callId() {
        return null;
    }

    default Map<String, Object> providerData() {
        return null;
    }
}
