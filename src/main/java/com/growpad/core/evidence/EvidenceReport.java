package com.growpad.core.evidence;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Result of evidence validation, written as {@code intake-report.json}.
 *
 * @param qualityScore 0..100, reduced by 25 per error and 10 per missing input
 * @param stackDetected language stack of the target, as far as the evidence reveals it
 * @param files         evidence files found, relative to the evidence directory
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EvidenceReport(
    boolean valid,
    List<String> errors,
    List<String> missingFields,
    int qualityScore,
    String stackDetected,
    List<String> files
) {}
