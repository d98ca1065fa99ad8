package com.growpad.core.approval;

import com.growpad.core.model.Guardrails;
import com.growpad.core.model.Workspace;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;

class LoggingApprovalNotifierTest {

    @Test
    void notifiesWithAndWithoutNamedApprovers() {
        ApprovalNotifier notifier = new LoggingApprovalNotifier();
        Instant now = Instant.now();
        Workspace named = new Workspace("ws_0123456789ab", "growth", "local://shop", "main",
                Guardrails.defaults(), true, List.of("alice"), now, now);
        Workspace open = new Workspace("ws_0123456789ab", "growth", "local://shop", "main",
                Guardrails.defaults(), true, null, now, now);

        assertDoesNotThrow(() -> notifier.requestApproval("run_0123456789ab", named, "Saved filters"));
        assertDoesNotThrow(() -> notifier.requestApproval("run_0123456789ab", open, "Saved filters"));
    }
}
