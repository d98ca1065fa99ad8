package com.growpad.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

class RunStatusTest {

    @ParameterizedTest
    @EnumSource(value = RunStatus.class, names = {"COMPLETED", "FAILED", "CANCELLED"})
    @DisplayName("Terminal statuses allow no transitions")
    void terminalIsFinal(RunStatus status) {
        assertTrue(status.isTerminal());
        for (RunStatus next : RunStatus.values()) {
            assertFalse(status.canTransitionTo(next), status + " -> " + next);
        }
    }

    @ParameterizedTest
    @EnumSource(value = RunStatus.class, names = {"PENDING", "RUNNING", "AWAITING_APPROVAL", "RETRYING"})
    @DisplayName("Cancel and fail are reachable from every live status")
    void cancelFromAnyLive(RunStatus status) {
        assertFalse(status.isTerminal());
        assertTrue(status.canTransitionTo(RunStatus.CANCELLED));
        assertTrue(status.canTransitionTo(RunStatus.FAILED));
    }

    @Test
    @DisplayName("Normal forward path is allowed")
    void forwardPath() {
        assertTrue(RunStatus.PENDING.canTransitionTo(RunStatus.RUNNING));
        assertTrue(RunStatus.RUNNING.canTransitionTo(RunStatus.AWAITING_APPROVAL));
        assertTrue(RunStatus.AWAITING_APPROVAL.canTransitionTo(RunStatus.RUNNING));
        assertTrue(RunStatus.RUNNING.canTransitionTo(RunStatus.RETRYING));
        assertTrue(RunStatus.RETRYING.canTransitionTo(RunStatus.RUNNING));
        assertTrue(RunStatus.RUNNING.canTransitionTo(RunStatus.COMPLETED));
    }

    @Test
    @DisplayName("Skipping RUNNING is rejected")
    void noShortcuts() {
        assertFalse(RunStatus.PENDING.canTransitionTo(RunStatus.COMPLETED));
        assertFalse(RunStatus.PENDING.canTransitionTo(RunStatus.RETRYING));
        assertFalse(RunStatus.RETRYING.canTransitionTo(RunStatus.COMPLETED));
    }
}
