package com.growpad.dispatch.api;

/**
 * Inbound JSON body for POST /api/v1/runs/{id}/approvals.
 *
 * @param approver who decides
 * @param decision APPROVED or CHANGES_REQUESTED
 */
public record ApprovalRequest(
    String approver,
    String decision
) {}
