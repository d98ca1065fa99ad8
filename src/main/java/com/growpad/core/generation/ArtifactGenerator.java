package com.growpad.core.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.growpad.core.llm.GenerationClient;
import com.growpad.core.llm.GenerationProperties;
import com.growpad.core.llm.GenerationTrace;
import com.growpad.core.model.EvidenceMap;
import com.growpad.core.model.FeatureCandidate;
import com.growpad.core.model.StageId;
import com.growpad.core.model.TicketPlan;
import com.growpad.core.store.JsonSupport;
import com.growpad.core.verify.VerificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Prompts for every generated artifact. Each call is recorded in the run's
 * {@link GenerationTrace}, including failed calls.
 */
@Service
public class ArtifactGenerator {

    private static final Logger log = LoggerFactory.getLogger(ArtifactGenerator.class);

    private static final int OUTPUT_TAIL = 4000;

    private final GenerationClient client;
    private final GenerationProperties properties;
    private final ObjectMapper mapper = JsonSupport.newMapper();

    public ArtifactGenerator(GenerationClient client, GenerationProperties properties) {
        this.client = client;
        this.properties = properties;
    }

    public JsonNode synthesize(String evidence, String goal, GenerationTrace trace) {
        String system = """
                You are an evidence synthesis agent. Respond with JSON only.
                Return keys: summary (string), claims (array), top_features (array of exactly 3 objects).
                Each claim includes claim_id, claim_text, supporting_sources (array of {file, line_range [start, end], quote}), confidence (0..1).
                Quotes are verbatim and at most 18 words. Cite line numbers exactly as shown in the evidence.
                Each top_features item includes feature, rationale, linked_claim_ids (array of claim ids).""";
        String user = "Goal statement: " + orDefault(goal, "Improve activation") + "\n\nEvidence:\n" + evidence;
        return traced(trace, "generate_json", StageId.SYNTHESIZE, user,
                () -> client.generateJson(system, user), JsonNode::toString);
    }

    public String prd(FeatureCandidate feature, EvidenceMap evidenceMap, String goal, GenerationTrace trace) {
        String system = """
                You are a product requirements writer. Produce markdown only with headings:
                Overview, Problem, Solution, Acceptance Criteria, Constraints, Non-goals, Why This Feature, Done Means.""";
        String user = "Selected feature JSON: " + json(feature)
                + "\nSupporting claims JSON: " + json(evidenceMap.claims())
                + "\nGoal statement: " + orDefault(goal, "")
                + "\nKeep acceptance criteria testable and scoped to a small, verifiable change.";
        String text = traced(trace, "generate_text", StageId.GENERATE_PRD, user,
                () -> client.generateText(system, user, properties.getTextTemperature()), s -> s);
        String cleaned = text.trim();
        return cleaned.startsWith("#") ? cleaned + "\n" : "# PRD\n\n" + cleaned + "\n";
    }

    /**
     * Mermaid user flow. Falls back to placeholder text when generation fails.
     */
    public String userFlow(FeatureCandidate feature, String prd, GenerationTrace trace) {
        String system = "Return only a Mermaid flowchart (starting with 'flowchart TD') of the user flow for the feature. No code fences.";
        String user = "Feature: " + feature.feature() + "\n\nPRD:\n" + prd;
        return secondary(trace, StageId.GENERATE_DESIGN, system, user,
                "flowchart TD\n  A[User] --> B[" + sanitizeLabel(feature.feature()) + "]\n  B --> C[Done]\n");
    }

    /**
     * Static HTML wireframes. Falls back to a placeholder page when generation fails.
     */
    public String wireframes(FeatureCandidate feature, String prd, GenerationTrace trace) {
        String system = "Return a single self-contained HTML document with low-fidelity wireframes for the feature. No code fences.";
        String user = "Feature: " + feature.feature() + "\n\nPRD:\n" + prd;
        return secondary(trace, StageId.GENERATE_DESIGN, system, user,
                "<!doctype html>\n<html><body><h1>" + escapeHtml(feature.feature())
                        + "</h1><p>Wireframes unavailable.</p></body></html>\n");
    }

    public JsonNode tickets(FeatureCandidate feature, String prd, GenerationTrace trace) {
        String system = """
                Return JSON only. Shape: {"epic_title": string, "tickets": [ ... ]}.
                Each ticket includes id, title, description, acceptance_criteria (array of strings),
                files_expected (array of repository-relative paths), risk_level (low, med or high), estimate_hours (number).""";
        String user = "Selected feature JSON: " + json(feature) + "\n\nPRD:\n" + prd;
        return traced(trace, "generate_json", StageId.GENERATE_TICKETS, user,
                () -> client.generateJson(system, user), JsonNode::toString);
    }

    public String codePatch(TicketPlan plan, String repoContext, GenerationTrace trace) {
        String system = """
                You are a coding agent. Generate a unified diff (git diff) implementing the tickets.
                Use standard `diff --git a/path b/path` format. Do not wrap the diff in markdown.
                Context lines must match the repository content exactly.""";
        String user = "Tickets: " + json(plan) + "\n\nRepository context:\n" + repoContext
                + "\n\nGenerate the minimal diff that satisfies the acceptance criteria.";
        return patch(trace, StageId.IMPLEMENT, system, user);
    }

    /**
     * Second attempt after the first patch did not apply.
     */
    public String regeneratePatch(TicketPlan plan, String repoContext, String rejectedPatch, String applyError,
                                  GenerationTrace trace) {
        String system = """
                You are a coding agent. Your previous unified diff could not be applied.
                Produce a corrected unified diff in `diff --git a/path b/path` format, without markdown.
                Context lines must match the repository content exactly.""";
        String user = "Tickets: " + json(plan)
                + "\n\nApply error:\n" + tail(applyError)
                + "\n\nRejected diff:\n" + tail(rejectedPatch)
                + "\n\nRepository context:\n" + repoContext;
        return patch(trace, StageId.IMPLEMENT, system, user);
    }

    public String fixPatch(int retryCount, VerificationResult failure, String repoContext, GenerationTrace trace) {
        String system = """
                You are a defect correction agent. Use the test failure log and repository content to produce a fix.
                Return only the unified diff. No explanations.""";
        String user = "Retry count: " + retryCount
                + "\nVerification summary: " + failure.summary()
                + "\nstdout:\n" + tail(failure.stdout())
                + "\n\nstderr:\n" + tail(failure.stderr())
                + "\n\nCurrent file content:\n" + repoContext
                + "\n\nGenerate a patch to fix the failure.";
        return patch(trace, StageId.SELF_HEAL, system, user);
    }

    private String patch(GenerationTrace trace, StageId stage, String system, String user) {
        return traced(trace, "generate_text", stage, user, () -> client.generateText(system, user, 0.0), s -> s).trim();
    }

    private String secondary(GenerationTrace trace, StageId stage, String system, String user, String placeholder) {
        try {
            String text = traced(trace, "generate_text", stage, user,
                    () -> client.generateText(system, user, properties.getTextTemperature()), s -> s);
            return stripFences(text).trim() + "\n";
        } catch (RuntimeException e) {
            log.warn("Secondary artifact generation failed, using placeholder: {}", e.getMessage());
            return placeholder;
        }
    }

    private <T> T traced(GenerationTrace trace, String function, StageId stage, String args,
                         Supplier<T> call, Function<T, String> summarize) {
        long start = System.currentTimeMillis();
        try {
            T result = call.get();
            trace.record(function, stage, args, summarize.apply(result), System.currentTimeMillis() - start, null);
            return result;
        } catch (RuntimeException e) {
            trace.record(function, stage, args, null, System.currentTimeMillis() - start, e.getMessage());
            throw e;
        }
    }

    private String json(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize prompt input", e);
        }
    }

    static String stripFences(String text) {
        String trimmed = text.trim();
        if (!trimmed.startsWith("```")) {
            return trimmed;
        }
        int firstNewline = trimmed.indexOf('\n');
        String body = firstNewline < 0 ? "" : trimmed.substring(firstNewline + 1);
        return body.endsWith("```") ? body.substring(0, body.length() - 3) : body;
    }

    private static String tail(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= OUTPUT_TAIL ? text : text.substring(text.length() - OUTPUT_TAIL);
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    private static String sanitizeLabel(String text) {
        return text.replaceAll("[\\[\\]\"]", "");
    }

    private static String escapeHtml(String text) {
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }
}
