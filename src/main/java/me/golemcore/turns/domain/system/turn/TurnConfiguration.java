package me.golemcore.turns.domain.system.turn;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.turns.domain.service.JsonSchemaValidator;
import me.golemcore.turns.domain.service.RunEventService;
import me.golemcore.turns.infrastructure.config.TurnEngineProperties;
import me.golemcore.turns.port.outbound.RunLifecycleListener;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;

/** Spring wiring for the turn engine (classifier, dispatcher, resolver). */
@Configuration
public class TurnConfiguration {

    @Bean
    public RunEventService runEventService(Clock clock, ObjectProvider<RunLifecycleListener> listeners) {
        return new RunEventService(clock, listeners.orderedStream().toList());
    }

    @Bean
    public ApprovalGate approvalGate() {
        return new ApprovalGate();
    }

    @Bean
    public FunctionToolExecutor functionToolExecutor(ObjectMapper objectMapper, JsonSchemaValidator schemaValidator,
            ApprovalGate approvalGate, RunEventService runEventService) {
        return new FunctionToolExecutor(objectMapper, schemaValidator, approvalGate, runEventService);
    }

    @Bean
    public ComputerActionExecutor computerActionExecutor(ApprovalGate approvalGate,
            RunEventService runEventService) {
        return new ComputerActionExecutor(approvalGate, runEventService);
    }

    @Bean
    public ShellActionExecutor shellActionExecutor(ApprovalGate approvalGate, RunEventService runEventService) {
        return new ShellActionExecutor(approvalGate, runEventService);
    }

    @Bean
    public ApplyPatchActionExecutor applyPatchActionExecutor(ApprovalGate approvalGate,
            RunEventService runEventService) {
        return new ApplyPatchActionExecutor(approvalGate, runEventService);
    }

    @Bean
    public McpApprovalExecutor mcpApprovalExecutor() {
        return new McpApprovalExecutor();
    }

    @Bean
    public ActionDispatcher actionDispatcher(ExecutorService turnDispatchExecutor,
            FunctionToolExecutor functionToolExecutor, ComputerActionExecutor computerActionExecutor,
            ShellActionExecutor shellActionExecutor, ApplyPatchActionExecutor applyPatchActionExecutor,
            McpApprovalExecutor mcpApprovalExecutor) {
        return new ActionDispatcher(turnDispatchExecutor, functionToolExecutor, computerActionExecutor,
                shellActionExecutor, applyPatchActionExecutor, mcpApprovalExecutor);
    }

    @Bean
    public ResponseClassifier responseClassifier() {
        return new ResponseClassifier();
    }

    @Bean
    public HandoffExecutor handoffExecutor(ObjectMapper objectMapper, RunEventService runEventService) {
        return new HandoffExecutor(objectMapper, runEventService);
    }

    @Bean
    public FinalOutputChecker finalOutputChecker(ObjectMapper objectMapper, JsonSchemaValidator schemaValidator,
            TurnEngineProperties properties) {
        return new FinalOutputChecker(objectMapper, schemaValidator,
                properties.getOutput().getSchemaErrorMaxLength());
    }

    @Bean
    public TurnResolver turnResolver(ActionDispatcher actionDispatcher, HandoffExecutor handoffExecutor,
            FinalOutputChecker finalOutputChecker, RunEventService runEventService,
            TurnEngineProperties properties) {
        return new TurnResolver(actionDispatcher, handoffExecutor, finalOutputChecker, runEventService,
                properties.getDispatch().getActionTimeout());
    }
}
