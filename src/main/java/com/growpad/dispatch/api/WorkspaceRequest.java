package com.growpad.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.growpad.core.model.Guardrails;
import com.growpad.core.model.Workspace;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/workspaces.
 *
 * @param teamName                owning team
 * @param repoUrl                 target repository; {@code local://name} for a local baseline
 * @param branch                  nullable, defaults to main
 * @param guardrails              nullable, defaults to two retries, read-only mode, /infra and /payments forbidden
 * @param approvalWorkflowEnabled whether runs stop for approval after design
 * @param approvers               named approvers; empty means any single decision counts
 */
public record WorkspaceRequest(
    @JsonProperty("team_name") String teamName,
    @JsonProperty("repo_url") String repoUrl,
    String branch,
    Guardrails guardrails,
    @JsonProperty("approval_workflow_enabled") boolean approvalWorkflowEnabled,
    List<String> approvers
) {

    Workspace toDraft() {
        return new Workspace(null, teamName, repoUrl, branch, guardrails, approvalWorkflowEnabled, approvers,
                null, null);
    }
}
