package com.growpad.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of a Growpad run.
 */
public enum RunStatus {
    PENDING,
    RUNNING,
    AWAITING_APPROVAL,
    RETRYING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Whether a run in this status may move to {@code next}.
     * CANCELLED and FAILED are reachable from every non-terminal status.
     */
    public boolean canTransitionTo(RunStatus next) {
        if (isTerminal()) {
            return false;
        }
        if (next == CANCELLED || next == FAILED) {
            return true;
        }
        return allowedTargets().contains(next);
    }

    private Set<RunStatus> allowedTargets() {
        return switch (this) {
            case PENDING -> EnumSet.of(RUNNING);
            case RUNNING -> EnumSet.of(AWAITING_APPROVAL, RETRYING, COMPLETED);
            case AWAITING_APPROVAL -> EnumSet.of(RUNNING);
            case RETRYING -> EnumSet.of(RUNNING);
            default -> EnumSet.noneOf(RunStatus.class);
        };
    }
}
