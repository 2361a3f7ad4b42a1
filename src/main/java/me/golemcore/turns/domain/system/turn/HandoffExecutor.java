package me.golemcore.turns.domain.system.turn;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.turns.domain.component.Handoff;
import me.golemcore.turns.domain.component.HandoffInputFilter;
import me.golemcore.turns.domain.exception.ModelBehaviorException;
import me.golemcore.turns.domain.model.Agent;
import me.golemcore.turns.domain.model.HandoffInputData;
import me.golemcore.turns.domain.model.action.HandoffAction;
import me.golemcore.turns.domain.model.item.HandoffOutputItem;
import me.golemcore.turns.domain.model.item.ItemIds;
import me.golemcore.turns.domain.model.item.RunItem;
import me.golemcore.turns.domain.model.item.ToolCallOutputItem;
import me.golemcore.turns.domain.model.protocol.FunctionCall;
import me.golemcore.turns.domain.model.protocol.FunctionCallResult;
import me.golemcore.turns.domain.model.protocol.ModelItem;
import me.golemcore.turns.domain.service.RunEventService;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Executes the first handoff requested in a turn. Later handoffs of the same
 * turn are answered with an "ignored" result and never invoked.
 */
@Slf4j
public class HandoffExecutor {

    static final String IGNORED_HANDOFF_MESSAGE = "Multiple handoffs detected, ignoring this one.";

    private final ObjectMapper objectMapper;
    private final RunEventService runEventService;

    public HandoffExecutor(ObjectMapper objectMapper, RunEventService runEventService) {
        this.objectMapper = objectMapper;
        this.runEventService = runEventService;
    }

    /**
     * @param newStepItems
     *            items the turn appended so far; the returned list extends a copy
     *            of it
     * @param defaultFilter
     *            run-level filter used when the handoff declares none; may be
     *            {@code null}
     */
    public HandoffResolution execute(DispatchContext context, List<HandoffAction> handoffs,
            List<ModelItem> originalInput, List<RunItem> preStepItems, List<RunItem> newStepItems,
            HandoffInputFilter defaultFilter) {
        if (handoffs.isEmpty()) {
            throw new IllegalArgumentException("No handoff to execute");
        }
        Agent agent = context.agent();
        List<HandoffAction> ordered = new ArrayList<>(handoffs);
        ordered.sort(Comparator.comparingInt(HandoffAction::sequence));
        List<RunItem> items = new ArrayList<>(newStepItems);

        if (ordered.size() > 1) {
            log.warn("[Handoff] Multiple handoffs requested by '{}': {}, only the first one runs", agent.getName(),
                    ordered.stream().map(action -> action.handoff().getAgentName()).toList());
            for (HandoffAction ignored : ordered.subList(1, ordered.size())) {
                FunctionCallResult result = FunctionCallResult.completed(ignored.rawItem(), IGNORED_HANDOFF_MESSAGE);
                items.add(new ToolCallOutputItem(ItemIds.generate(), agent.getName(), result,
                        IGNORED_HANDOFF_MESSAGE));
            }
        }

        HandoffAction chosen = ordered.get(0);
        Handoff handoff = chosen.handoff();
        FunctionCall call = chosen.rawItem();
        Agent newAgent = Awaits.await(handoff.invoke(context.runContext(), call.arguments()),
                context.actionTimeout());
        if (newAgent == null) {
            throw new ModelBehaviorException("Handoff " + handoff.getToolName() + " did not produce an agent",
                    agent.getName(), handoff.getToolName());
        }

        items.add(new HandoffOutputItem(ItemIds.generate(), agent.getName(),
                FunctionCallResult.completed(call, transferMessage(newAgent)), agent.getName(), newAgent.getName()));
        log.info("[Handoff] '{}' -> '{}'", agent.getName(), newAgent.getName());
        runEventService.handoff(agent, newAgent);

        HandoffInputFilter filter = handoff.getInputFilter() != null ? handoff.getInputFilter() : defaultFilter;
        if (filter == null) {
            return new HandoffResolution(newAgent, originalInput, preStepItems, items);
        }
        log.debug("[Handoff] filtering inputs for '{}'", newAgent.getName());
        HandoffInputData filtered = filter.apply(new HandoffInputData(List.copyOf(originalInput),
                List.copyOf(preStepItems), List.copyOf(items)));
        return new HandoffResolution(newAgent, filtered.inputHistory(), filtered.preHandoffItems(),
                filtered.newItems());
    }

    String transferMessage(Agent newAgent) {
        try {
            return objectMapper.writeValueAsString(Map.of("assistant", newAgent.getName()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render transfer message", e);
        }
    }

    /**
     * History after the handoff, possibly rewritten by an input filter.
     */
    public record HandoffResolution(Agent newAgent, List<ModelItem> originalInput, List<RunItem> preStepItems,
            List<RunItem> newStepItems) {
    }
}
