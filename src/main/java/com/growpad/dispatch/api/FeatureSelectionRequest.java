package com.growpad.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/runs/{id}/select-feature.
 */
public record FeatureSelectionRequest(
    @JsonProperty("selected_feature_index") Integer selectedFeatureIndex
) {}
