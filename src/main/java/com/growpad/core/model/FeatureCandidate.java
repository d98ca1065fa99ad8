package com.growpad.core.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * A feature proposed by synthesis, linked back to the claims that support it.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FeatureCandidate(
    String feature,
    String rationale,
    List<String> linkedClaimIds
) {}
