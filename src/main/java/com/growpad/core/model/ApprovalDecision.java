package com.growpad.core.model;

/**
 * Decision recorded by a single approver.
 */
public enum ApprovalDecision {
    APPROVED,
    CHANGES_REQUESTED
}
