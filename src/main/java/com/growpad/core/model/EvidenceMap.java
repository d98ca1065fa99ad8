package com.growpad.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Synthesized claims over the evidence and the three candidate features derived from them.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EvidenceMap(
    String summary,
    List<Claim> claims,
    List<FeatureCandidate> topFeatures,
    FeatureChoice featureChoice
) {

    public EvidenceMap withFeatureChoice(FeatureChoice choice) {
        return new EvidenceMap(summary, claims, topFeatures, choice);
    }

    /** Mean claim confidence, or {@code fallback} when there are no claims. */
    public double meanConfidence(double fallback) {
        return claims.stream().mapToDouble(Claim::confidence).average().orElse(fallback);
    }
}
