package me.golemcore.turns.domain.model;

import me.golemcore.turns.domain.model.item.ToolApprovalItem;
import me.golemcore.turns.domain.model.protocol.FunctionCall;
import me.golemcore.turns.domain.model.protocol.HostedToolCall;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ToolApprovalStoreTest {

    private static final String TOOL = "send_email";

    private ToolApprovalStore store;

    @BeforeEach
    void setUp() {
        store = new ToolApprovalStore();
    }

    @Test
    void shouldBeUndecidedByDefault() {
        assertEquals(ApprovalDecision.UNDECIDED, store.isApproved(TOOL, "call_1"));
    }

    @Test
    void shouldRecordPerCallDecisions() {
        store.approve(TOOL, "call_1", false);
        store.reject(TOOL, "call_2", false);

        assertEquals(ApprovalDecision.APPROVED, store.isApproved(TOOL, "call_1"));
        assertEquals(ApprovalDecision.REJECTED, store.isApproved(TOOL, "call_2"));
        assertEquals(ApprovalDecision.UNDECIDED, store.isApproved(TOOL, "call_3"));
        assertEquals(ApprovalDecision.UNDECIDED, store.isApproved(TOOL, null));
    }

    @Test
    void shouldLetLaterDecisionOverrideEarlierOne() {
        store.approve(TOOL, "call_1", false);
        store.reject(TOOL, "call_1", false);

        assertEquals(ApprovalDecision.REJECTED, store.isApproved(TOOL, "call_1"));
    }

    @Test
    void shouldApplyAlwaysDecisionToEveryCall() {
        store.reject(TOOL, "call_1", false);
        store.approve(TOOL, null, true);

        assertEquals(ApprovalDecision.APPROVED, store.isApproved(TOOL, "call_1"));
        assertEquals(ApprovalDecision.APPROVED, store.isApproved(TOOL, null));

        store.reject(TOOL, null, true);
        assertEquals(ApprovalDecision.REJECTED, store.isApproved(TOOL, "call_9"));
    }

    @Test
    void shouldRequireCallIdForSingleDecision() {
        assertThrows(IllegalArgumentException.class, () -> store.approve(TOOL, " ", false));
    }

    @Test
    void shouldKeyRemoteRequestsByItemId() {
        HostedToolCall request = new HostedToolCall("mcpr_1", "search", "{}", null, null, null);
        store.approve(new ToolApprovalItem("item_1", "agent", request, "search"), false);

        assertEquals(ApprovalDecision.APPROVED, store.isApproved("search", "mcpr_1"));
    }

    @Test
    void shouldRestoreFromSnapshot() {
        store.approve(new ToolApprovalItem("item_1", "agent",
                new FunctionCall("fc_1", "call_1", TOOL, "{}", "completed"), TOOL), false);
        store.reject("delete", null, true);

        Map<String, ToolApprovalStore.Snapshot> snapshot = store.snapshot();
        ToolApprovalStore restored = ToolApprovalStore.restore(snapshot);

        assertEquals(ApprovalDecision.APPROVED, restored.isApproved(TOOL, "call_1"));
        assertEquals(ApprovalDecision.REJECTED, restored.isApproved("delete", "anything"));
        assertEquals(snapshot, restored.snapshot());
    }
}
