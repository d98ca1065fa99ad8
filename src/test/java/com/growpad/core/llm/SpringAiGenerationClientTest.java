package com.growpad.core.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.growpad.core.model.StageId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.ObjectProvider;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SpringAiGenerationClientTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Nested
    @DisplayName("parseJsonObject")
    class ParseJsonObject {

        @Test
        @DisplayName("Parses a bare JSON object")
        void bareObject() {
            JsonNode node = SpringAiGenerationClient.parseJsonObject("{\"a\": 1}", mapper);
            assertEquals(1, node.get("a").asInt());
        }

        @Test
        @DisplayName("Strips json code fences")
        void fenced() {
            JsonNode node = SpringAiGenerationClient.parseJsonObject("```json\n{\"a\": 2}\n```", mapper);
            assertEquals(2, node.get("a").asInt());
        }

        @Test
        @DisplayName("Extracts the object from surrounding prose")
        void prose() {
            JsonNode node = SpringAiGenerationClient.parseJsonObject(
                    "Here you go: {\"tickets\": []} Let me know!", mapper);
            assertTrue(node.get("tickets").isArray());
        }

        @Test
        @DisplayName("Rejects responses without an object")
        void noObject() {
            assertThrows(GenerationParseException.class,
                    () -> SpringAiGenerationClient.parseJsonObject("[1, 2, 3]", mapper));
            assertThrows(GenerationParseException.class,
                    () -> SpringAiGenerationClient.parseJsonObject("I cannot help with that.", mapper));
        }

        @Test
        @DisplayName("Broken JSON between braces is a parse error")
        void brokenObject() {
            assertThrows(GenerationParseException.class,
                    () -> SpringAiGenerationClient.parseJsonObject("x {\"a\": } y", mapper));
        }
    }

    @Nested
    @DisplayName("Without a configured provider")
    class Unconfigured {

        @SuppressWarnings("unchecked")
        private SpringAiGenerationClient client(String apiKey) {
            ObjectProvider<ChatClient.Builder> provider = mock(ObjectProvider.class);
            GenerationProperties properties = new GenerationProperties();
            properties.setApiKey(apiKey);
            return new SpringAiGenerationClient(provider, properties);
        }

        @Test
        @DisplayName("Blank key makes the client unavailable")
        void unavailable() {
            assertFalse(client("").isAvailable());
        }

        @Test
        @DisplayName("Calls fail with GenerationUnavailableException")
        void callsFail() {
            SpringAiGenerationClient client = client("");
            assertThrows(GenerationUnavailableException.class, () -> client.generateText("s", "u", 0.2));
            assertThrows(GenerationUnavailableException.class, () -> client.generateJson("s", "u"));
        }

        @Test
        @DisplayName("A key without a chat model is still unavailable")
        void keyWithoutModel() {
            SpringAiGenerationClient client = client("sk-test");
            assertFalse(client.isAvailable());
            assertThrows(GenerationUnavailableException.class, () -> client.generateText("s", "u", 0.2));
        }
    }

    @Test
    @DisplayName("Trace numbers calls and abbreviates long summaries")
    void traceRecords() {
        GenerationTrace trace = new GenerationTrace();
        trace.record("generate_text", StageId.GENERATE_PRD, "x".repeat(500), "ok", 12, null);
        trace.record("generate_json", StageId.GENERATE_TICKETS, "a\n\n b", null, 3, "boom");

        assertEquals("call_1", trace.calls().get(0).id());
        assertEquals(240, trace.calls().get(0).argsSummary().length());
        assertTrue(trace.calls().get(0).argsSummary().endsWith("..."));
        assertEquals("a b", trace.calls().get(1).argsSummary());
        assertEquals("boom", trace.calls().get(1).error());
    }
}
