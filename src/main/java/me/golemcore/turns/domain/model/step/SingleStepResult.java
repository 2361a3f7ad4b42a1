package me.golemcore.turns.domain.model.step;

import me.golemcore.turns.domain.model.ModelResponse;
import me.golemcore.turns.domain.model.item.RunItem;
import me.golemcore.turns.domain.model.protocol.ModelItem;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one resolver invocation.
 *
 * @param originalInput
 *            run input, possibly rewritten by a handoff input filter
 * @param modelResponse
 *            the response this turn resolved
 * @param preStepItems
 *            history inherited by the turn
 * @param newStepItems
 *            items this turn appended, in response order
 * @param nextStep
 *            what the run loop does next
 * @param persistedItemCount
 *            how many leading generated items are already accounted for in
 *            session storage
 */
public record SingleStepResult(List<ModelItem> originalInput, ModelResponse modelResponse,
        List<RunItem> preStepItems, List<RunItem> newStepItems, NextStep nextStep, int persistedItemCount) {

    public SingleStepResult {
        originalInput = List.copyOf(originalInput);
        preStepItems = List.copyOf(preStepItems);
        newStepItems = List.copyOf(newStepItems);
    }

    public List<RunItem> generatedItems() {
        List<RunItem> items = new ArrayList<>(preStepItems.size() + newStepItems.size());
        items.addAll(preStepItems);
        items.addAll(newStepItems);
        return items;
    }
}
