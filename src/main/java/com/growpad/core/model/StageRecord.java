package com.growpad.core.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * One entry of a run's stage history.
 *
 * @param stage       the stage that ran
 * @param outcome     DONE, FAILED or SKIPPED
 * @param startedAt   when the stage began
 * @param completedAt when the stage finished
 * @param error       failure text; null unless the outcome is FAILED
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StageRecord(
    StageId stage,
    StageOutcome outcome,
    Instant startedAt,
    Instant completedAt,
    String error
) {}
