package me.golemcore.turns.domain.model;

import me.golemcore.turns.domain.model.item.ToolApprovalItem;
import me.golemcore.turns.domain.model.protocol.ModelItem;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Approval decisions keyed by (tool name, call id).
 *
 * <p>
 * A decision is either per call id or "always" for every call of the tool. Reads
 * may run concurrently with dispatch; writes from approvers are serialized.
 */
public class ToolApprovalStore {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Entry> entries = new LinkedHashMap<>();

    public ApprovalDecision isApproved(String toolName, String callId) {
        lock.readLock().lock();
        try {
            Entry entry = entries.get(toolName);
            if (entry == null) {
                return ApprovalDecision.UNDECIDED;
            }
            if (entry.approvedAll) {
                return ApprovalDecision.APPROVED;
            }
            if (entry.rejectedAll) {
                return ApprovalDecision.REJECTED;
            }
            if (callId == null) {
                return ApprovalDecision.UNDECIDED;
            }
            if (entry.approved.contains(callId)) {
                return ApprovalDecision.APPROVED;
            }
            if (entry.rejected.contains(callId)) {
                return ApprovalDecision.REJECTED;
            }
            return ApprovalDecision.UNDECIDED;
        } finally {
            lock.readLock().unlock();
        }
    }

    public void approve(ToolApprovalItem item, boolean always) {
        approve(item.toolName(), callIdOf(item.rawItem()), always);
    }

    public void reject(ToolApprovalItem item, boolean always) {
        reject(item.toolName(), callIdOf(item.rawItem()), always);
    }

    public void approve(String toolName, String callId, boolean always) {
        Objects.requireNonNull(toolName, "toolName");
        lock.writeLock().lock();
        try {
            Entry entry = entries.computeIfAbsent(toolName, key -> new Entry());
            if (always) {
                entry.approvedAll = true;
                entry.rejectedAll = false;
                entry.rejected.clear();
                return;
            }
            requireCallId(toolName, callId);
            entry.approved.add(callId);
            entry.rejected.remove(callId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void reject(String toolName, String callId, boolean always) {
        Objects.requireNonNull(toolName, "toolName");
        lock.writeLock().lock();
        try {
            Entry entry = entries.computeIfAbsent(toolName, key -> new Entry());
            if (always) {
                entry.rejectedAll = true;
                entry.approvedAll = false;
                entry.approved.clear();
                return;
            }
            requireCallId(toolName, callId);
            entry.rejected.add(callId);
            entry.approved.remove(callId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Map<String, Snapshot> snapshot() {
        lock.readLock().lock();
        try {
            Map<String, Snapshot> copy = new LinkedHashMap<>();
            entries.forEach((toolName, entry) -> copy.put(toolName, new Snapshot(entry.approvedAll,
                    entry.rejectedAll, Set.copyOf(entry.approved), Set.copyOf(entry.rejected))));
            return copy;
        } finally {
            lock.readLock().unlock();
        }
    }

    public static ToolApprovalStore restore(Map<String, Snapshot> snapshot) {
        ToolApprovalStore store = new ToolApprovalStore();
        if (snapshot == null) {
            return store;
        }
        snapshot.forEach((toolName, saved) -> {
            Entry entry = new Entry();
            entry.approvedAll = saved.approvedAll();
            entry.rejectedAll = saved.rejectedAll();
            if (saved.approved() != null) {
                entry.approved.addAll(saved.approved());
            }
            if (saved.rejected() != null) {
                entry.rejected.addAll(saved.rejected());
            }
            store.entries.put(toolName, entry);
        });
        return store;
    }

    /**
     * Key a decision is stored under: the call id, or the item id for records
     * without one (remote approval requests).
     */
    public static String callIdOf(ModelItem rawItem) {
        if (rawItem == null) {
            return null;
        }
        return rawItem.callId() != null ? rawItem.callId() : rawItem.id();
    }

    private static void requireCallId(String toolName, String callId) {
        if (callId == null || callId.isBlank()) {
            throw new IllegalArgumentException("Call id required for a single decision on tool " + toolName);
        }
    }

    /**
     * Serializable form of the decisions recorded for one tool.
     */
    public record Snapshot(boolean approvedAll, boolean rejectedAll, Set<String> approved, Set<String> rejected) {
    }

    private static final class Entry {
        private boolean approvedAll;
        private boolean rejectedAll;
        private final Set<String> approved = new LinkedHashSet<>();
        private final Set<String> rejected = new LinkedHashSet<>();
    }
}
