package me.golemcore.turns.domain.model;

/**
 * Three-valued answer of the approval store for one (tool name, call id).
 */
public enum ApprovalDecision {
    APPROVED, REJECTED, UNDECIDED
}
