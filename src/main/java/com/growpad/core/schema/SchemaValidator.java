package com.growpad.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.growpad.core.model.Claim;
import com.growpad.core.model.EvidenceMap;
import com.growpad.core.model.FeatureCandidate;
import com.growpad.core.model.SupportingSource;
import com.growpad.core.model.Ticket;
import com.growpad.core.model.TicketPlan;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Turns generated JSON into typed records, or rejects it.
 * <p>
 * Each conversion first fills the gaps a model commonly leaves (missing ids, alternate
 * key names, single-number line ranges), then checks the result strictly. Every
 * violation is collected before throwing.
 */
@Component
public class SchemaValidator {

    public static final int TOP_FEATURE_COUNT = 3;
    public static final int MAX_QUOTE_WORDS = 18;
    private static final Set<String> RISK_LEVELS = Set.of("low", "med", "high");

    /**
     * @throws SchemaValidationException if the payload is not a valid evidence map
     */
    public EvidenceMap evidenceMap(JsonNode payload) {
        List<String> violations = new ArrayList<>();
        if (payload == null || !payload.isObject()) {
            throw new SchemaValidationException("evidence map", List.of("payload is not a JSON object"));
        }
        String summary = text(payload, "summary", "Evidence synthesis summary");

        List<Claim> claims = new ArrayList<>();
        JsonNode claimsNode = payload.path("claims");
        if (!claimsNode.isArray()) {
            violations.add("claims must be an array");
        }
        int index = 0;
        for (JsonNode node : iterable(claimsNode)) {
            index++;
            if (!node.isObject()) {
                violations.add("claims[" + (index - 1) + "] is not an object");
                continue;
            }
            String claimId = firstText(node, "C" + index, "claim_id", "id");
            String claimText = firstText(node, "", "claim_text", "claim");
            if (claimText.isBlank()) {
                violations.add("claim " + claimId + " has no claim_text");
            }
            double confidence = node.path("confidence").asDouble(0.5);
            if (confidence < 0.0 || confidence > 1.0) {
                violations.add("claim " + claimId + " confidence " + confidence + " outside [0, 1]");
            }
            claims.add(new Claim(claimId, claimText, sources(node, claimId, violations), confidence));
        }

        List<String> claimIds = claims.stream().map(Claim::claimId).toList();
        List<FeatureCandidate> features = new ArrayList<>();
        JsonNode featuresNode = payload.path("top_features");
        int featureIndex = 0;
        for (JsonNode node : iterable(featuresNode)) {
            featureIndex++;
            if (!node.isObject()) {
                violations.add("top_features[" + (featureIndex - 1) + "] is not an object");
                continue;
            }
            String feature = text(node, "feature", "");
            if (feature.isBlank()) {
                violations.add("top_features[" + (featureIndex - 1) + "] has no feature");
            }
            List<String> linked = strings(node.path("linked_claim_ids"));
            if (linked.isEmpty()) {
                linked = claimIds.subList(0, Math.min(2, claimIds.size()));
            }
            features.add(new FeatureCandidate(feature, text(node, "rationale", "Evidence-backed opportunity"),
                    List.copyOf(linked)));
        }
        if (features.size() != TOP_FEATURE_COUNT) {
            violations.add("top_features must contain exactly " + TOP_FEATURE_COUNT + " items, got " + features.size());
        }

        if (!violations.isEmpty()) {
            throw new SchemaValidationException("evidence map", violations);
        }
        return new EvidenceMap(summary, List.copyOf(claims), List.copyOf(features), null);
    }

    /**
     * @throws SchemaValidationException if the payload is not a valid ticket plan
     */
    public TicketPlan ticketPlan(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            throw new SchemaValidationException("tickets", List.of("payload is not a JSON object"));
        }
        List<String> violations = new ArrayList<>();
        JsonNode ticketsNode = payload.path("tickets");
        if (!ticketsNode.isArray() || ticketsNode.isEmpty()) {
            throw new SchemaValidationException("tickets", List.of("tickets must be a non-empty array"));
        }
        List<Ticket> tickets = new ArrayList<>();
        int index = 0;
        for (JsonNode node : ticketsNode) {
            index++;
            if (!node.isObject()) {
                violations.add("tickets[" + (index - 1) + "] is not an object");
                continue;
            }
            String id = text(node, "id", "T" + index);
            String title = text(node, "title", "");
            if (title.isBlank()) {
                violations.add("ticket " + id + " has no title");
            }
            String risk = normalizeRisk(text(node, "risk_level", "low"));
            if (!RISK_LEVELS.contains(risk)) {
                violations.add("ticket " + id + " risk_level '" + risk + "' not in " + RISK_LEVELS);
            }
            JsonNode estimate = node.path("estimate_hours");
            double hours = 1.0;
            if (estimate.isNumber()) {
                hours = estimate.asDouble();
            } else if (!estimate.isMissingNode() && !estimate.isNull()) {
                violations.add("ticket " + id + " estimate_hours is not numeric");
            }
            if (hours < 0) {
                violations.add("ticket " + id + " estimate_hours is negative");
            }
            List<String> criteria = strings(node.path("acceptance_criteria"));
            if (criteria.isEmpty()) {
                criteria = List.of("Verification must pass");
            }
            String owner = node.hasNonNull("owner") ? node.get("owner").asText() : null;
            tickets.add(new Ticket(id, title, text(node, "description", ""), criteria,
                    strings(node.path("files_expected")), risk, hours, owner));
        }
        if (!violations.isEmpty()) {
            throw new SchemaValidationException("tickets", violations);
        }
        return new TicketPlan(text(payload, "epic_title", "Feature Implementation"), List.copyOf(tickets));
    }

    private List<SupportingSource> sources(JsonNode claim, String claimId, List<String> violations) {
        List<SupportingSource> sources = new ArrayList<>();
        JsonNode sourcesNode = claim.path("supporting_sources");
        if (!sourcesNode.isArray() && claim.path("evidence_ref").isTextual()) {
            sources.add(new SupportingSource(claim.get("evidence_ref").asText(), List.of(1, 1), ""));
            return sources;
        }
        for (JsonNode src : iterable(sourcesNode)) {
            if (!src.isObject()) {
                continue;
            }
            List<Integer> range = List.of(1, 1);
            JsonNode rangeNode = src.path("line_range");
            if (rangeNode.isArray() && rangeNode.size() >= 2) {
                range = List.of(rangeNode.get(0).asInt(1), rangeNode.get(1).asInt(1));
            } else if (rangeNode.isInt()) {
                range = List.of(rangeNode.asInt(), rangeNode.asInt());
            }
            String quote = text(src, "quote", "");
            int words = quote.isBlank() ? 0 : quote.trim().split("\\s+").length;
            if (words > MAX_QUOTE_WORDS) {
                violations.add("claim " + claimId + " quote has " + words + " words, limit " + MAX_QUOTE_WORDS);
            }
            sources.add(new SupportingSource(text(src, "file", ""), range, quote));
        }
        return sources;
    }

    private static String normalizeRisk(String risk) {
        String lower = risk.trim().toLowerCase(Locale.ROOT);
        return "medium".equals(lower) ? "med" : lower;
    }

    private static String text(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() && !value.isContainerNode() ? value.asText() : fallback;
    }

    private static String firstText(JsonNode node, String fallback, String... fields) {
        for (String field : fields) {
            String value = text(node, field, "");
            if (!value.isBlank()) {
                return value;
            }
        }
        return fallback;
    }

    private static List<String> strings(JsonNode array) {
        List<String> values = new ArrayList<>();
        for (JsonNode item : iterable(array)) {
            if (item.isValueNode() && !item.asText().isBlank()) {
                values.add(item.asText());
            }
        }
        return List.copyOf(values);
    }

    private static Iterable<JsonNode> iterable(JsonNode node) {
        return node != null && node.isArray() ? node : List.of();
    }
}
