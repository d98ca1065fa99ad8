package com.growpad.core.logging;

import com.growpad.core.model.StageId;
import org.slf4j.MDC;

/**
 * Utility for managing Growpad-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId, String workspaceId) {
        MDC.put("runId", runId);
        MDC.put("workspaceId", workspaceId);
    }

    public static void setStage(StageId stage) {
        if (stage == null) {
            MDC.remove("stage");
        } else {
            MDC.put("stage", stage.name());
        }
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("workspaceId");
        MDC.remove("stage");
    }
}
