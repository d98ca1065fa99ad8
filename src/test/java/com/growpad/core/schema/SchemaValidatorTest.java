package com.growpad.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.growpad.core.model.Claim;
import com.growpad.core.model.EvidenceMap;
import com.growpad.core.model.TicketPlan;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SchemaValidatorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final SchemaValidator validator = new SchemaValidator();

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }

    @Nested
    @DisplayName("Evidence map")
    class EvidenceMaps {

        private static final String FEATURES = """
                "top_features": [
                  {"feature": "Bulk export", "rationale": "Asked for in 4 interviews", "linked_claim_ids": ["C1"]},
                  {"feature": "Saved filters"},
                  {"feature": "Slack alerts", "rationale": "Churn driver"}
                ]""";

        @Test
        @DisplayName("Fills missing ids, single-number line ranges and default links")
        void normalizes() throws Exception {
            EvidenceMap map = validator.evidenceMap(json("""
                    {"summary": "Users want exports",
                     "claims": [
                       {"claim": "Exports are manual", "supporting_sources": [{"file": "interviews/a.md", "line_range": 4, "quote": "I copy rows by hand"}], "confidence": 0.8},
                       {"claim_id": "X9", "claim_text": "Filters reset", "evidence_ref": "support_tickets.csv"}
                     ],
                    %s}
                    """.formatted(FEATURES)));

            assertEquals("Users want exports", map.summary());
            Claim first = map.claims().get(0);
            assertEquals("C1", first.claimId());
            assertEquals(List.of(4, 4), first.supportingSources().get(0).lineRange());
            Claim second = map.claims().get(1);
            assertEquals("X9", second.claimId());
            assertEquals(0.5, second.confidence());
            assertEquals("support_tickets.csv", second.supportingSources().get(0).file());
            assertEquals(List.of("C1", "X9"), map.topFeatures().get(1).linkedClaimIds());
            assertNull(map.featureChoice());
        }

        @Test
        @DisplayName("Collects every violation before rejecting")
        void collectsViolations() throws Exception {
            SchemaValidationException e = assertThrows(SchemaValidationException.class, () ->
                    validator.evidenceMap(json("""
                            {"claims": [{"claim_text": "", "confidence": 1.5}],
                             "top_features": [{"feature": "Only one"}]}
                            """)));

            assertEquals("evidence map", e.getSchema());
            assertEquals(3, e.getViolations().size());
            assertTrue(e.getMessage().contains("exactly 3"));
        }

        @Test
        @DisplayName("Rejects quotes longer than the word limit")
        void longQuote() throws Exception {
            String quote = "one two three four five six seven eight nine ten eleven twelve thirteen fourteen fifteen sixteen seventeen eighteen nineteen";
            SchemaValidationException e = assertThrows(SchemaValidationException.class, () ->
                    validator.evidenceMap(json("""
                            {"claims": [{"claim_text": "x", "supporting_sources": [{"file": "f.md", "line_range": [1, 2], "quote": "%s"}]}],
                            %s}
                            """.formatted(quote, FEATURES))));

            assertTrue(e.getViolations().get(0).contains("19 words"));
        }

        @Test
        @DisplayName("Rejects non-object payloads")
        void notAnObject() throws Exception {
            assertThrows(SchemaValidationException.class, () -> validator.evidenceMap(json("[1, 2]")));
            assertThrows(SchemaValidationException.class, () -> validator.evidenceMap(null));
        }
    }

    @Nested
    @DisplayName("Ticket plan")
    class Tickets {

        @Test
        @DisplayName("Normalizes risk, defaults ids and criteria, sums estimates")
        void normalizes() throws Exception {
            TicketPlan plan = validator.ticketPlan(json("""
                    {"epic_title": "Bulk export",
                     "tickets": [
                       {"title": "Add CSV writer", "risk_level": "Medium", "estimate_hours": 3, "files_expected": ["src/app/export.py"]},
                       {"id": "T9", "title": "Wire endpoint", "files_expected": ["src/app/export.py", "src/app/api.py"]}
                     ]}
                    """));

            assertEquals("Bulk export", plan.epicTitle());
            assertEquals("T1", plan.tickets().get(0).id());
            assertEquals("med", plan.tickets().get(0).riskLevel());
            assertEquals(List.of("Verification must pass"), plan.tickets().get(1).acceptanceCriteria());
            assertEquals(4.0, plan.totalEstimateHours());
            assertEquals(List.of("src/app/export.py", "src/app/api.py"), plan.expectedFiles());
        }

        @Test
        @DisplayName("Rejects unknown risk levels and non-numeric estimates")
        void invalidFields() throws Exception {
            SchemaValidationException e = assertThrows(SchemaValidationException.class, () ->
                    validator.ticketPlan(json("""
                            {"tickets": [{"title": "x", "risk_level": "extreme", "estimate_hours": "soon"}]}
                            """)));

            assertEquals(2, e.getViolations().size());
        }

        @Test
        @DisplayName("Rejects an empty ticket list")
        void emptyTickets() throws Exception {
            assertThrows(SchemaValidationException.class, () -> validator.ticketPlan(json("{\"tickets\": []}")));
        }
    }
}
