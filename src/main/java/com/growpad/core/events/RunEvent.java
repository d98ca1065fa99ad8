package com.growpad.core.events;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.growpad.core.model.StageId;

import java.time.Instant;

/**
 * An entry in a run's audit log and live stream.
 *
 * @param timestamp when the event was produced
 * @param stage     stage the event belongs to; null for run-level events before the first stage
 * @param component producer, usually {@code orchestrator}
 * @param action    what happened, e.g. {@code stage_start}, {@code stage_end}, {@code verification}
 * @param outcome   result label, e.g. {@code started}, {@code done}, {@code failed}
 * @param latencyMs elapsed time for the action, when measured
 * @param error     failure text, when any
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RunEvent(
    Instant timestamp,
    StageId stage,
    String component,
    String action,
    String outcome,
    Long latencyMs,
    String error
) {

    public static final String ORCHESTRATOR = "orchestrator";
    public static final String STAGE_START = "stage_start";
    public static final String STAGE_END = "stage_end";

    public static RunEvent stageStart(StageId stage) {
        return new RunEvent(Instant.now(), stage, ORCHESTRATOR, STAGE_START, "started", null, null);
    }

    public static RunEvent stageEnd(StageId stage, String outcome, long latencyMs, String error) {
        return new RunEvent(Instant.now(), stage, ORCHESTRATOR, STAGE_END, outcome, latencyMs, error);
    }

    public static RunEvent of(StageId stage, String action, String outcome, Long latencyMs, String error) {
        return new RunEvent(Instant.now(), stage, ORCHESTRATOR, action, outcome, latencyMs, error);
    }

    public boolean isRunTerminal() {
        return "run_completed".equals(action) || "run_failed".equals(action) || "run_cancelled".equals(action);
    }
}
