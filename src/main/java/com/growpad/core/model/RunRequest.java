package com.growpad.core.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Map;
import java.util.TreeMap;

/**
 * Request to start a run.
 *
 * @param workspaceId          workspace to run against
 * @param evidenceDir          evidence directory; nullable, falls back to the configured sample evidence
 * @param goalStatement        optional product goal passed to generation
 * @param fastMode             select a feature without waiting; nullable, defaults to true
 * @param selectedFeatureIndex pre-selected feature, 0..2; nullable
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RunRequest(
    String workspaceId,
    String evidenceDir,
    String goalStatement,
    Boolean fastMode,
    Integer selectedFeatureIndex
) {

    public RunRequest {
        if (fastMode == null) {
            fastMode = Boolean.TRUE;
        }
        if (goalStatement == null) {
            goalStatement = "";
        }
    }

    /** Canonical, key-sorted view used for the inputs hash. */
    public Map<String, Object> canonicalPayload() {
        Map<String, Object> payload = new TreeMap<>();
        payload.put("evidence_dir", evidenceDir);
        payload.put("fast_mode", fastMode);
        payload.put("goal_statement", goalStatement);
        payload.put("selected_feature_index", selectedFeatureIndex);
        payload.put("workspace_id", workspaceId);
        return payload;
    }
}
