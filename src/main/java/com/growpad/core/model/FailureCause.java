package com.growpad.core.model;

/**
 * Reason a run terminated without completing.
 */
public enum FailureCause {
    VALIDATION,
    GENERATION_UNAVAILABLE,
    PATCH_APPLY,
    FEATURE_SELECTION_TIMEOUT,
    APPROVAL_TIMEOUT,
    APPROVAL_REJECTED,
    VERIFICATION,
    INFRASTRUCTURE,
    CANCELLED
}
