package com.growpad.core.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.growpad.core.store.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/**
 * {@link GenerationClient} over Spring AI's {@link ChatClient}.
 * <p>
 * The client is built lazily on first use so the application starts without a
 * configured provider; every call then fails with {@link GenerationUnavailableException}.
 */
@Service
public class SpringAiGenerationClient implements GenerationClient {

    private static final Logger log = LoggerFactory.getLogger(SpringAiGenerationClient.class);

    private final ObjectProvider<ChatClient.Builder> builderProvider;
    private final GenerationProperties properties;
    private final ObjectMapper mapper = JsonSupport.newMapper();
    private volatile ChatClient chatClient;

    public SpringAiGenerationClient(ObjectProvider<ChatClient.Builder> builderProvider,
                                    GenerationProperties properties) {
        this.builderProvider = builderProvider;
        this.properties = properties;
    }

    @Override
    public boolean isAvailable() {
        return properties.hasApiKey() && builderProvider.getIfAvailable() != null;
    }

    @Override
    public String generateText(String systemPrompt, String userPrompt, double temperature) {
        ChatClient client = client();
        long start = System.currentTimeMillis();
        String response;
        try {
            response = client.prompt()
                    .system(systemPrompt)
                    .user(userPrompt)
                    .options(ChatOptions.builder().model(properties.getModel()).temperature(temperature).build())
                    .call()
                    .content();
        } catch (RuntimeException e) {
            throw new GenerationUnavailableException("Generation call failed: " + e.getMessage(), e);
        }
        log.info("Generation call complete ({}s)", String.format("%.1f", (System.currentTimeMillis() - start) / 1000.0));
        if (response == null || response.isBlank()) {
            throw new GenerationUnavailableException("Generation returned empty content");
        }
        return response;
    }

    @Override
    public JsonNode generateJson(String systemPrompt, String userPrompt) {
        String response = generateText(systemPrompt + "\nRespond with a single JSON object only.", userPrompt,
                properties.getJsonTemperature());
        return parseJsonObject(response, mapper);
    }

    /**
     * Extracts a JSON object from a response that may be wrapped in code fences or prose.
     */
    static JsonNode parseJsonObject(String raw, ObjectMapper mapper) {
        String cleaned = raw.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        cleaned = cleaned.trim();
        try {
            JsonNode node = mapper.readTree(cleaned);
            if (node != null && node.isObject()) {
                return node;
            }
        } catch (JsonProcessingException e) {
            log.debug("Direct JSON parse failed, trying brace extraction: {}", e.getOriginalMessage());
        }
        int start = cleaned.indexOf('{');
        int end = cleaned.lastIndexOf('}');
        if (start >= 0 && end > start) {
            try {
                JsonNode node = mapper.readTree(cleaned.substring(start, end + 1));
                if (node.isObject()) {
                    return node;
                }
            } catch (JsonProcessingException e) {
                throw new GenerationParseException("Response is not valid JSON: " + e.getOriginalMessage(), e);
            }
        }
        throw new GenerationParseException("Response holds no JSON object", null);
    }

    private ChatClient client() {
        if (!properties.hasApiKey()) {
            throw new GenerationUnavailableException("Generation provider is not configured (growpad.generation.api-key is blank)");
        }
        ChatClient client = chatClient;
        if (client == null) {
            synchronized (this) {
                if (chatClient == null) {
                    ChatClient.Builder builder = builderProvider.getIfAvailable();
                    if (builder == null) {
                        throw new GenerationUnavailableException("No chat model is configured");
                    }
                    chatClient = builder.build();
                    log.info("Generation client initialized (model {})", properties.getModel());
                }
                client = chatClient;
            }
        }
        return client;
    }
}
