package com.growpad.core.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * A cited location in the evidence.
 *
 * @param file      evidence file name
 * @param lineRange two line numbers, start and end
 * @param quote     verbatim excerpt, at most 18 words
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SupportingSource(
    String file,
    List<Integer> lineRange,
    String quote
) {}
