package com.growpad.core.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * The feature picked at the selection gate.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FeatureChoice(
    int selectedIndex,
    String selectedFeature,
    String selectedBy
) {}
