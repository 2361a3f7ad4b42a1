package me.golemcore.turns.domain.loop;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.turns.domain.exception.MaxTurnsExceededException;
import me.golemcore.turns.domain.exception.RunCancelledException;
import me.golemcore.turns.domain.exception.UserException;
import me.golemcore.turns.domain.model.Agent;
import me.golemcore.turns.domain.model.CancellationToken;
import me.golemcore.turns.domain.model.ModelResponse;
import me.golemcore.turns.domain.model.ProcessedResponse;
import me.golemcore.turns.domain.model.item.RunItem;
import me.golemcore.turns.domain.model.item.ToolApprovalItem;
import me.golemcore.turns.domain.model.protocol.ModelItem;
import me.golemcore.turns.domain.model.step.FinalOutput;
import me.golemcore.turns.domain.model.step.HandoffStep;
import me.golemcore.turns.domain.model.step.SingleStepResult;
import me.golemcore.turns.domain.service.RunEventService;
import me.golemcore.turns.domain.system.turn.ResponseClassifier;
import me.golemcore.turns.domain.system.turn.TurnRequest;
import me.golemcore.turns.domain.system.turn.TurnResolver;
import me.golemcore.turns.infrastructure.config.TurnEngineProperties;
import me.golemcore.turns.port.outbound.ModelPort;
import me.golemcore.turns.port.outbound.SessionPort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Drives a run turn by turn: asks the model, classifies the response, lets the
 * resolver dispatch and decide, and applies the next step until the run
 * finishes or stops on approvals.
 *
 * <p>
 * Items are written to the session after every committed turn, starting at the
 * state's persisted item count. A cancelled run throws
 * {@link RunCancelledException} carrying a state that resumes the cancelled
 * turn; results of actions that completed before cancellation are part of that
 * state and are not produced again.
 */
@Service
@Slf4j
public class AgentRunner {

    private final ModelPort modelPort;
    private final SessionPort sessionPort;
    private final ResponseClassifier responseClassifier;
    private final TurnResolver turnResolver;
    private final RunEventService runEventService;
    private final TurnEngineProperties properties;

    public AgentRunner(ModelPort modelPort, SessionPort sessionPort, ResponseClassifier responseClassifier,
            TurnResolver turnResolver, RunEventService runEventService, TurnEngineProperties properties) {
        this.modelPort = modelPort;
        this.sessionPort = sessionPort;
        this.responseClassifier = responseClassifier;
        this.turnResolver = turnResolver;
        this.runEventService = runEventService;
        this.properties = properties;
    }

    public RunResult run(Agent agent, List<ModelItem> input, RunOptions options) {
        int maxTurns = options.getMaxTurns() != null ? options.getMaxTurns()
                : properties.getRunner().getMaxTurns();
        RunState state = RunState.start(agent, input, options.getRunContext(), maxTurns);
        log.info("[Runner] starting run with agent '{}' (max turns {})", agent.getName(), maxTurns);
        if (options.getSessionId() != null && !input.isEmpty()) {
            sessionPort.addItems(options.getSessionId(), input);
        }
        return loop(state, options);
    }

    /**
     * Continues a run that stopped on approvals or was cancelled. Decisions
     * recorded on the state's context since then apply to this pass.
     */
    public RunResult resume(RunState state, RunOptions options) {
        if (state.isFinished()) {
            throw new UserException("Run already produced its final output");
        }
        if (state.hasTurnInFlight() && state.getLastProcessedResponse() == null) {
            state.setLastProcessedResponse(
                    responseClassifier.classify(state.getLastModelResponse(), state.getCurrentAgent()));
        }
        log.info("[Runner] resuming agent '{}' ({} pending approval(s))", state.getCurrentAgent().getName(),
                state.getInterruptions().size());
        return loop(state, options);
    }

    private RunResult loop(RunState state, RunOptions options) {
        CancellationToken cancellation = options.getCancellation() != null ? options.getCancellation()
                : new CancellationToken();
        try {
            while (true) {
                cancellation.throwIfCancelled();
                SingleStepResult step = state.hasTurnInFlight()
                        ? resumeTurn(state, options, cancellation)
                        : nextTurn(state, options, cancellation);
                commit(state, step, options);

                switch (step.nextStep().kind()) {
                case FINAL_OUTPUT -> {
                    String output = ((FinalOutput) step.nextStep()).output();
                    runEventService.agentFinished(state.getCurrentAgent(), output);
                    log.info("[Runner] run finished by agent '{}' after {} turn(s)",
                            state.getCurrentAgent().getName(), state.getCurrentTurn());
                    return result(state, output);
                }
                case INTERRUPTION -> {
                    state.setTurnInFlight(true);
                    log.info("[Runner] run paused on {} approval(s)", state.getInterruptions().size());
                    return result(state, null);
                }
                case HANDOFF -> {
                    Agent next = ((HandoffStep) step.nextStep()).newAgent();
                    log.info("[Runner] switching agent '{}' -> '{}'", state.getCurrentAgent().getName(),
                            next.getName());
                    state.setCurrentAgent(next);
                }
                case RUN_AGAIN -> log.debug("[Runner] agent '{}' runs again", state.getCurrentAgent().getName());
                }
            }
        } catch (RunCancelledException e) {
            if (e.getGeneratedItems() != null) {
                state.setGeneratedItems(new ArrayList<>(e.getGeneratedItems()));
            }
            log.info("[Runner] run cancelled at turn {}", state.getCurrentTurn());
            throw e.withState(state);
        }
    }

    private SingleStepResult nextTurn(RunState state, RunOptions options, CancellationToken cancellation) {
        if (state.getCurrentTurn() >= state.getMaxTurns()) {
            log.error("[Runner] max turns ({}) exceeded", state.getMaxTurns());
            throw new MaxTurnsExceededException(state.getMaxTurns());
        }
        Agent agent = state.getCurrentAgent();
        if (state.getStartedAgent() != agent) {
            runEventService.agentStarted(agent);
            state.setStartedAgent(agent);
        }
        log.debug("[Runner] turn {} for agent '{}'", state.getCurrentTurn() + 1, agent.getName());

        ModelResponse response = awaitModel(modelPort.getResponse(agent, state.modelInput()), cancellation)
                .withResponseIdIfMissing();
        state.setCurrentTurn(state.getCurrentTurn() + 1);
        ProcessedResponse processed = responseClassifier.classify(response, agent);
        state.getToolUseTracker().addToolUse(agent.getName(), processed.toolsUsed());
        state.setLastModelResponse(response);
        state.setLastProcessedResponse(processed);
        state.setCurrentStep(null);
        state.setTurnInFlight(true);

        return turnResolver.resolveTurnAfterModelResponse(request(state, options, cancellation, List.of()));
    }

    private SingleStepResult resumeTurn(RunState state, RunOptions options, CancellationToken cancellation) {
        if (state.getStartedAgent() != state.getCurrentAgent()) {
            runEventService.agentStarted(state.getCurrentAgent());
            state.setStartedAgent(state.getCurrentAgent());
        }
        return turnResolver.resolveInterruptedTurn(
                request(state, options, cancellation, state.getInterruptions()));
    }

    private TurnRequest request(RunState state, RunOptions options, CancellationToken cancellation,
            List<ToolApprovalItem> pendingApprovals) {
        return TurnRequest.builder()
                .agent(state.getCurrentAgent())
                .runContext(state.getRunContext())
                .originalInput(state.getOriginalInput())
                .preStepItems(state.getGeneratedItems())
                .modelResponse(state.getLastModelResponse())
                .processedResponse(state.getLastProcessedResponse())
                .persistedItemCount(state.getPersistedItemCount())
                .pendingApprovals(pendingApprovals)
                .cancellation(cancellation)
                .handoffInputFilter(options.getHandoffInputFilter())
                .build();
    }

    private void commit(RunState state, SingleStepResult step, RunOptions options) {
        List<RunItem> generated = step.generatedItems();
        state.setOriginalInput(new ArrayList<>(step.originalInput()));
        state.setGeneratedItems(generated);
        state.setPersistedItemCount(Math.min(step.persistedItemCount(), generated.size()));
        state.setCurrentStep(step.nextStep());
        state.setTurnInFlight(false);
        flush(state, options.getSessionId());
    }

    /**
     * Writes generated items past the persisted count, skipping approval
     * placeholders, and advances the count.
     */
    void flush(RunState state, String sessionId) {
        List<RunItem> generated = state.getGeneratedItems();
        int from = Math.min(state.getPersistedItemCount(), generated.size());
        if (sessionId != null) {
            List<ModelItem> pending = generated.subList(from, generated.size()).stream()
                    .filter(item -> !(item instanceof ToolApprovalItem))
                    .map(RunItem::rawItem)
                    .toList();
            if (!pending.isEmpty()) {
                sessionPort.addItems(sessionId, pending);
                log.debug("[Runner] persisted {} item(s) to session {}", pending.size(), sessionId);
            }
        }
        state.setPersistedItemCount(generated.size());
    }

    private ModelResponse awaitModel(CompletableFuture<ModelResponse> response, CancellationToken cancellation) {
        try {
            CompletableFuture.anyOf(response, cancellation.whenCancelled()).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            response.cancel(true);
            throw new RunCancelledException("Interrupted while waiting for the model", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new CompletionException(cause);
        }
        if (!response.isDone()) {
            response.cancel(true);
            throw new RunCancelledException("Run cancelled while waiting for the model");
        }
        return response.join();
    }

    private RunResult result(RunState state, String finalOutput) {
        return new RunResult(finalOutput, state.getInterruptions(), state.getCurrentAgent(),
                state.getGeneratedItems(), state);
    }
}
