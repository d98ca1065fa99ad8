package com.growpad.core.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;

/**
 * A configured target: repository plus safety and approval policy.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Workspace(
    String workspaceId,
    String teamName,
    String repoUrl,
    String branch,
    Guardrails guardrails,
    boolean approvalWorkflowEnabled,
    List<String> approvers,
    Instant createdAt,
    Instant updatedAt
) {

    public Workspace {
        if (guardrails == null) {
            guardrails = Guardrails.defaults();
        }
        if (branch == null || branch.isBlank()) {
            branch = "main";
        }
        approvers = approvers == null ? List.of() : List.copyOf(approvers);
    }
}
