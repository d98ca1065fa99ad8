package com.growpad.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * An implementation ticket.
 *
 * @param riskLevel one of {@code low}, {@code med}, {@code high}
 * @param owner     optional
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Ticket(
    String id,
    String title,
    String description,
    List<String> acceptanceCriteria,
    List<String> filesExpected,
    String riskLevel,
    double estimateHours,
    String owner
) {}
