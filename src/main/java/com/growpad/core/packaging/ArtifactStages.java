package com.growpad.core.packaging;

import java.util.List;
import java.util.Map;

/**
 * Fixed mapping from artifact file name to the stage that produces it.
 */
public final class ArtifactStages {

    public static final String RUN = "RUN";
    public static final String UNKNOWN = "UNKNOWN";

    public static final String MANIFEST = "manifest.json";
    public static final String ARCHIVE = "artifacts.zip";

    /** Artifacts every finished run should have produced. */
    public static final List<String> REQUIRED = List.of(
            "PRD.md", "wireframes.html", "user-flow.mmd", "tickets.json",
            "evidence-map.json", "diff.patch", "test-report.md", "run-log.jsonl");

    private static final Map<String, String> BY_NAME = Map.ofEntries(
            Map.entry("intake-report.json", "INTAKE"),
            Map.entry("evidence-map.json", "SYNTHESIZE"),
            Map.entry("selected-feature.json", "SELECT_FEATURE"),
            Map.entry("PRD.md", "GENERATE_PRD"),
            Map.entry("wireframes.html", "GENERATE_DESIGN"),
            Map.entry("user-flow.mmd", "GENERATE_DESIGN"),
            Map.entry("approval-request.json", "AWAITING_APPROVAL"),
            Map.entry("tickets.json", "GENERATE_TICKETS"),
            Map.entry("diff.patch", "IMPLEMENT"),
            Map.entry("pr-mode.md", "IMPLEMENT"),
            Map.entry("test-report.md", "VERIFY"),
            Map.entry("generation-trace.json", "EXPORT"),
            Map.entry("run-log.jsonl", RUN),
            Map.entry("run-summary.json", RUN),
            Map.entry("failure-report.md", RUN));

    private ArtifactStages() {}

    public static String stageOf(String fileName) {
        String stage = BY_NAME.get(fileName);
        if (stage != null) {
            return stage;
        }
        if (fileName.startsWith("fix-") && fileName.endsWith(".patch")) {
            return "SELF_HEAL";
        }
        return UNKNOWN;
    }
}
