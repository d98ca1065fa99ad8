package com.growpad.core.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Claim(
    String claimId,
    String claimText,
    List<SupportingSource> supportingSources,
    double confidence
) {}
