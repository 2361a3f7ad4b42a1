package me.golemcore.turns.domain.model;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Names of the tools each agent invoked during the run, in first-use order.
 */
public class ToolUseTracker {

    private final Map<String, Set<String>> toolsByAgent = new LinkedHashMap<>();

    public synchronized void addToolUse(String agentName, Collection<String> toolNames) {
        if (toolNames == null || toolNames.isEmpty()) {
            return;
        }
        toolsByAgent.computeIfAbsent(agentName, key -> new LinkedHashSet<>()).addAll(toolNames);
    }

    public synchronized boolean hasUsedTools(String agentName) {
        Set<String> tools = toolsByAgent.get(agentName);
        return tools != null && !tools.isEmpty();
    }

    public synchronized List<String> toolsUsedBy(String agentName) {
        Set<String> tools = toolsByAgent.get(agentName);
        return tools != null ? List.copyOf(tools) : List.of();
    }

    public synchronized Map<String, List<String>> snapshot() {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        toolsByAgent.forEach((agent, tools) -> copy.put(agent, List.copyOf(tools)));
        return copy;
    }

    public static ToolUseTracker restore(Map<String, List<String>> snapshot) {
        ToolUseTracker tracker = new ToolUseTracker();
        if (snapshot != null) {
            snapshot.forEach(tracker::addToolUse);
        }
        return tracker;
    }
}
