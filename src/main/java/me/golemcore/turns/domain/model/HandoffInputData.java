package me.golemcore.turns.domain.model;

import me.golemcore.turns.domain.model.item.RunItem;
import me.golemcore.turns.domain.model.protocol.ModelItem;

import java.util.List;

/**
 * History handed to a handoff input filter.
 *
 * @param inputHistory
 *            original run input
 * @param preHandoffItems
 *            items generated before the current turn
 * @param newItems
 *            items generated in the current turn, including the handoff result
 */
public record HandoffInputData(List<ModelItem> inputHistory, List<RunItem> preHandoffItems, List<RunItem> newItems) {
}
