package me.golemcore.turns.domain.system.turn;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.turns.domain.component.FunctionToolComponent;
import me.golemcore.turns.domain.component.GuardrailOutput;
import me.golemcore.turns.domain.component.ToolInputGuardrail;
import me.golemcore.turns.domain.component.ToolOutputGuardrail;
import me.golemcore.turns.domain.exception.AgentsException;
import me.golemcore.turns.domain.exception.ToolCallException;
import me.golemcore.turns.domain.exception.ToolInputGuardrailTripwireException;
import me.golemcore.turns.domain.exception.ToolOutputGuardrailTripwireException;
import me.golemcore.turns.domain.model.Agent;
import me.golemcore.turns.domain.model.FunctionToolResult;
import me.golemcore.turns.domain.model.ToolArguments;
import me.golemcore.turns.domain.model.ToolDefinition;
import me.golemcore.turns.domain.model.action.FunctionToolAction;
import me.golemcore.turns.domain.model.item.ItemIds;
import me.golemcore.turns.domain.model.item.ToolCallOutputItem;
import me.golemcore.turns.domain.model.protocol.FunctionCall;
import me.golemcore.turns.domain.model.protocol.FunctionCallResult;
import me.golemcore.turns.domain.service.JsonSchemaValidator;
import me.golemcore.turns.domain.service.RunEventService;

import java.util.List;

/**
 * Runs one function-tool action: argument parsing, approval, input
 * guardrails, invocation and output guardrails.
 */
@Slf4j
public class FunctionToolExecutor {

    static final String REJECTION_MESSAGE = "Tool execution was not approved.";
    private static final String ARGUMENTS_ERROR_PREFIX = "An error occurred while parsing tool arguments. "
            + "Please try again with valid JSON. Error: ";

    private final ObjectMapper objectMapper;
    private final JsonSchemaValidator schemaValidator;
    private final ApprovalGate approvalGate;
    private final RunEventService runEventService;

    public FunctionToolExecutor(ObjectMapper objectMapper, JsonSchemaValidator schemaValidator,
            ApprovalGate approvalGate, RunEventService runEventService) {
        this.objectMapper = objectMapper;
        this.schemaValidator = schemaValidator;
        this.approvalGate = approvalGate;
        this.runEventService = runEventService;
    }

    public ActionOutcome execute(DispatchContext context, FunctionToolAction action) {
        FunctionCall call = action.rawItem();
        FunctionToolComponent tool = action.tool();
        String agentName = context.agent().getName();

        ParsedArguments parsed = parseArguments(tool.getDefinition(), call.arguments());
        if (parsed.error() != null) {
            log.warn("[Dispatch] invalid arguments for '{}' ({}): {}", call.name(), call.callId(), parsed.error());
            String output = ARGUMENTS_ERROR_PREFIX + parsed.error();
            return notExecuted(action, agentName, output);
        }
        ToolArguments arguments = parsed.arguments();

        ApprovalGate.ApprovalCheck approval = approvalGate.check(context, call, tool.getToolName(), call.callId(),
                tool.needsApproval(context.runContext(), arguments, call.callId()), null);
        switch (approval.decision()) {
        case REJECTED:
            log.debug("[Dispatch] '{}' ({}) rejected", call.name(), call.callId());
            return notExecuted(action, agentName, REJECTION_MESSAGE);
        case UNDECIDED:
            log.debug("[Dispatch] '{}' ({}) waits for approval", call.name(), call.callId());
            return ActionOutcome.pendingFunction(action.sequence(), approval.placeholder(),
                    new FunctionToolResult(tool.getToolName(), call.callId(), null, approval.placeholder(), false));
        case APPROVED:
        default:
            break;
        }

        try {
            String output = run(context, tool, call, arguments);
            ToolCallOutputItem item = outputItem(agentName, call, output);
            return ActionOutcome.function(action.sequence(), item,
                    new FunctionToolResult(tool.getToolName(), call.callId(), output, item, true));
        } catch (AgentsException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ToolCallException(tool.getToolName(), call.callId(), Awaits.unwrap(e));
        }
    }

    private String run(DispatchContext context, FunctionToolComponent tool, FunctionCall call,
            ToolArguments arguments) {
        Agent agent = context.agent();
        String rejected = runInputGuardrails(context, tool, call, arguments);
        runEventService.toolStarted(agent, tool.getToolName(), call.callId());
        if (rejected != null) {
            runEventService.toolFinished(agent, tool.getToolName(), call.callId(), rejected);
            return rejected;
        }
        try {
            Object result = Awaits.await(tool.invoke(context.runContext(), arguments), context.actionTimeout());
            String output = runOutputGuardrails(context, tool, call, stringify(result));
            runEventService.toolFinished(agent, tool.getToolName(), call.callId(), output);
            return output;
        } catch (RuntimeException e) {
            runEventService.toolFailed(agent, tool.getToolName(), call.callId(), Awaits.unwrap(e));
            throw e;
        }
    }

    private String runInputGuardrails(DispatchContext context, FunctionToolComponent tool, FunctionCall call,
            ToolArguments arguments) {
        List<ToolInputGuardrail> guardrails = tool.getInputGuardrails();
        for (ToolInputGuardrail guardrail : guardrails) {
            GuardrailOutput result = Awaits.await(
                    guardrail.check(context.runContext(), context.agent().getName(), call, arguments),
                    context.actionTimeout());
            if (result == null) {
                continue;
            }
            switch (result.behavior()) {
            case REJECT_CONTENT:
                log.info("[Dispatch] input guardrail '{}' rejected '{}' ({})", guardrail.getName(), call.name(),
                        call.callId());
                return result.message();
            case THROW_EXCEPTION:
                throw new ToolInputGuardrailTripwireException(guardrail.getName(), tool.getToolName(),
                        result.outputInfo());
            case ALLOW:
            default:
                break;
            }
        }
        return null;
    }

    private String runOutputGuardrails(DispatchContext context, FunctionToolComponent tool, FunctionCall call,
            String output) {
        for (ToolOutputGuardrail guardrail : tool.getOutputGuardrails()) {
            GuardrailOutput result = Awaits.await(
                    guardrail.check(context.runContext(), context.agent().getName(), call, output),
                    context.actionTimeout());
            if (result == null) {
                continue;
            }
            switch (result.behavior()) {
            case REJECT_CONTENT:
                log.info("[Dispatch] output guardrail '{}' replaced the result of '{}' ({})", guardrail.getName(),
                        call.name(), call.callId());
                return result.message();
            case THROW_EXCEPTION:
                throw new ToolOutputGuardrailTripwireException(guardrail.getName(), tool.getToolName(),
                        result.outputInfo());
            case ALLOW:
            default:
                break;
            }
        }
        return output;
    }

    ParsedArguments parseArguments(ToolDefinition definition, String raw) {
        if (definition == null || definition.getInputSchema() == null) {
            return new ParsedArguments(ToolArguments.rawText(raw), null);
        }
        String text = raw == null || raw.isBlank() ? "{}" : raw;
        JsonNode json;
        try {
            json = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            return new ParsedArguments(null, e.getOriginalMessage());
        }
        List<JsonSchemaValidator.Violation> violations = schemaValidator.validate(json, definition.getInputSchema());
        if (!violations.isEmpty()) {
            JsonSchemaValidator.Violation first = violations.get(0);
            return new ParsedArguments(null, first.path() + ": " + first.message());
        }
        return new ParsedArguments(new ToolArguments(raw, json), null);
    }

    private ActionOutcome notExecuted(FunctionToolAction action, String agentName, String output) {
        FunctionCall call = action.rawItem();
        ToolCallOutputItem item = outputItem(agentName, call, output);
        return ActionOutcome.function(action.sequence(), item,
                new FunctionToolResult(action.toolName(), call.callId(), output, item, false));
    }

    private ToolCallOutputItem outputItem(String agentName, FunctionCall call, String output) {
        return new ToolCallOutputItem(ItemIds.generate(), agentName, FunctionCallResult.completed(call, output),
                output);
    }

    private String stringify(Object result) {
        if (result == null) {
            return "";
        }
        if (result instanceof String text) {
            return text;
        }
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            return String.valueOf(result);
        }
    }

    record ParsedArguments(ToolArguments arguments, String error) {
    }
}
