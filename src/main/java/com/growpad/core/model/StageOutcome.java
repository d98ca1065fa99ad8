package com.growpad.core.model;

/**
 * Outcome recorded for a finished stage.
 */
public enum StageOutcome {
    DONE,
    FAILED,
    SKIPPED
}
