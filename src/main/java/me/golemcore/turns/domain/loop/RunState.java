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

import lombok.Getter;
import lombok.Setter;
import me.golemcore.turns.domain.model.Agent;
import me.golemcore.turns.domain.model.ModelResponse;
import me.golemcore.turns.domain.model.ProcessedResponse;
import me.golemcore.turns.domain.model.RunContext;
import me.golemcore.turns.domain.model.ToolUseTracker;
import me.golemcore.turns.domain.model.item.RunItem;
import me.golemcore.turns.domain.model.item.ToolApprovalItem;
import me.golemcore.turns.domain.model.protocol.ModelItem;
import me.golemcore.turns.domain.model.step.FinalOutput;
import me.golemcore.turns.domain.model.step.Interruption;
import me.golemcore.turns.domain.model.step.NextStep;

import java.util.ArrayList;
import java.util.List;

/**
 * Resumable state of one run.
 *
 * <p>
 * {@code persistedItemCount} indexes {@link #getGeneratedItems()}: items
 * before it are already written to session storage. {@code turnInFlight} marks
 * a model response that was classified but whose turn never committed, either
 * because it stopped on approvals or because the run was cancelled. After a
 * cancelled dispatch the generated items already hold the results of actions
 * that completed, past the persisted count.
 */
@Getter
@Setter
public class RunState {

    private Agent currentAgent;
    private RunContext runContext;
    private List<ModelItem> originalInput = new ArrayList<>();
    private List<RunItem> generatedItems = new ArrayList<>();
    private ModelResponse lastModelResponse;
    private ProcessedResponse lastProcessedResponse;
    private NextStep currentStep;
    private boolean turnInFlight;
    private int currentTurn;
    private int maxTurns;
    private int persistedItemCount;
    private ToolUseTracker toolUseTracker = new ToolUseTracker();

    /** Agent whose start event was last emitted; not part of the snapshot. */
    private Agent startedAgent;

    public static RunState start(Agent agent, List<ModelItem> input, RunContext runContext, int maxTurns) {
        RunState state = new RunState();
        state.setCurrentAgent(agent);
        state.setRunContext(runContext != null ? runContext : new RunContext());
        state.setOriginalInput(new ArrayList<>(input));
        state.setMaxTurns(maxTurns);
        return state;
    }

    /**
     * Approvals the run stopped on; empty unless the last turn was interrupted.
     */
    public List<ToolApprovalItem> getInterruptions() {
        if (currentStep instanceof Interruption interruption) {
            return interruption.pendingApprovals();
        }
        return List.of();
    }

    public boolean isFinished() {
        return currentStep instanceof FinalOutput;
    }

    public boolean hasTurnInFlight() {
        return turnInFlight && lastModelResponse != null;
    }

    public void approve(ToolApprovalItem item) {
        runContext.approveTool(item);
    }

    public void approve(ToolApprovalItem item, boolean always) {
        runContext.approveTool(item, always);
    }

    public void reject(ToolApprovalItem item) {
        runContext.rejectTool(item);
    }

    public void reject(ToolApprovalItem item, boolean always) {
        runContext.rejectTool(item, always);
    }

    /**
     * Input for the next model call: run input followed by generated items,
     * without approval placeholders.
     */
    public List<ModelItem> modelInput() {
        List<ModelItem> input = new ArrayList<>(originalInput);
        for (RunItem item : generatedItems) {
            if (!(item instanceof ToolApprovalItem)) {
                input.add(item.rawItem());
            }
        }
        return input;
    }
}
