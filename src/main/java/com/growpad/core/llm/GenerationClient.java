package com.growpad.core.llm;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Text and JSON generation used by the pipeline stages.
 * Implementations throw {@link GenerationUnavailableException} when the provider
 * is not configured or cannot be reached.
 */
public interface GenerationClient {

    String generateText(String systemPrompt, String userPrompt, double temperature);

    /**
     * @throws GenerationParseException if the response holds no JSON object
     */
    JsonNode generateJson(String systemPrompt, String userPrompt);

    boolean isAvailable();
}
