package com.growpad.core.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Map;

/**
 * Queryable snapshot of a run.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RunSummary(
    String runId,
    String workspaceId,
    RunStatus status,
    StageId currentStage,
    int retryCount,
    Map<String, String> outputsIndex,
    Map<String, ApprovalDecision> approvalState,
    FailureCause failureCause,
    String lastError
) {}
