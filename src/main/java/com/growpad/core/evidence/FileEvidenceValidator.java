package com.growpad.core.evidence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.growpad.core.store.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Validates an evidence directory laid out as:
 * <pre>
 * interviews/*.md          required
 * support_tickets.csv      required: ticket_id, created_at, summary, severity
 * usage_metrics.csv|.json  required: metric, current_value, target_value
 * competitors.md, nps_comments.csv, changelog.md   optional
 * </pre>
 */
@Service
public class FileEvidenceValidator implements EvidenceValidator {

    private static final Logger log = LoggerFactory.getLogger(FileEvidenceValidator.class);

    static final Set<String> SUPPORT_COLUMNS = Set.of("ticket_id", "created_at", "summary", "severity");
    static final Set<String> USAGE_COLUMNS = Set.of("metric", "current_value", "target_value");
    static final List<String> OPTIONAL_FILES = List.of("competitors.md", "nps_comments.csv", "changelog.md");

    private final ObjectMapper mapper = JsonSupport.newMapper();

    @Override
    public EvidenceReport validate(Path evidenceDir) {
        List<String> errors = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        List<String> files = new ArrayList<>();

        if (!Files.isDirectory(evidenceDir)) {
            errors.add("Evidence directory does not exist: " + evidenceDir);
            missing.add("evidence_dir");
            return report(errors, missing, "other", files);
        }

        List<Path> interviews = interviewFiles(evidenceDir);
        if (interviews.isEmpty()) {
            errors.add("Missing required interviews markdown files under interviews/*.md");
            missing.add("interviews");
        } else {
            interviews.forEach(p -> files.add(evidenceDir.relativize(p).toString()));
        }

        Path support = evidenceDir.resolve("support_tickets.csv");
        if (!Files.isRegularFile(support)) {
            errors.add("Missing required file support_tickets.csv");
            missing.add("support_tickets.csv");
        } else {
            files.add("support_tickets.csv");
            checkCsv(support, SUPPORT_COLUMNS, errors);
        }

        Path usageCsv = evidenceDir.resolve("usage_metrics.csv");
        Path usageJson = evidenceDir.resolve("usage_metrics.json");
        if (Files.isRegularFile(usageCsv)) {
            files.add("usage_metrics.csv");
            checkCsv(usageCsv, USAGE_COLUMNS, errors);
        } else if (Files.isRegularFile(usageJson)) {
            files.add("usage_metrics.json");
            checkUsageJson(usageJson, errors);
        } else {
            errors.add("Missing required usage metrics file (usage_metrics.csv or usage_metrics.json)");
            missing.add("usage_metrics");
        }

        for (String optional : OPTIONAL_FILES) {
            if (Files.isRegularFile(evidenceDir.resolve(optional))) {
                files.add(optional);
            }
        }

        EvidenceReport report = report(errors, missing, detectStack(evidenceDir), files);
        log.info("Evidence in {}: valid={}, score={}", evidenceDir, report.valid(), report.qualityScore());
        return report;
    }

    static List<Path> interviewFiles(Path evidenceDir) {
        Path dir = evidenceDir.resolve("interviews");
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.filter(p -> p.getFileName().toString().endsWith(".md"))
                    .filter(Files::isRegularFile)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            log.warn("Could not list interviews in {}: {}", dir, e.getMessage());
            return List.of();
        }
    }

    private void checkCsv(Path file, Set<String> required, List<String> errors) {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8).stream().filter(l -> !l.isBlank()).toList();
        } catch (IOException e) {
            errors.add("Failed to read " + file.getFileName() + ": " + e.getMessage());
            return;
        }
        if (lines.size() < 2) {
            errors.add(file.getFileName() + " is empty");
            return;
        }
        Set<String> header = new TreeSet<>(parseCsvHeader(lines.get(0)));
        Set<String> absent = new TreeSet<>(required);
        absent.removeAll(header);
        if (!absent.isEmpty()) {
            errors.add(file.getFileName() + " missing columns: " + absent);
        }
    }

    private void checkUsageJson(Path file, List<String> errors) {
        JsonNode metrics;
        try {
            JsonNode root = mapper.readTree(file.toFile());
            metrics = root.isArray() ? root : root.path("metrics");
        } catch (IOException e) {
            errors.add("Failed to parse usage metrics: " + e.getMessage());
            return;
        }
        if (!metrics.isArray()) {
            errors.add("usage_metrics.json must be a list or {\"metrics\": [...]}");
            return;
        }
        if (metrics.isEmpty()) {
            errors.add("usage metrics file is empty");
            return;
        }
        Set<String> absent = new TreeSet<>(USAGE_COLUMNS);
        Iterator<String> names = metrics.get(0).fieldNames();
        while (names.hasNext()) {
            absent.remove(names.next());
        }
        if (!absent.isEmpty()) {
            errors.add("usage metrics missing columns: " + absent);
        }
    }

    static List<String> parseCsvHeader(String line) {
        List<String> columns = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (char c : line.toCharArray()) {
            if (c == '"') {
                quoted = !quoted;
            } else if (c == ',' && !quoted) {
                columns.add(current.toString().trim());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        columns.add(current.toString().trim());
        if (!columns.isEmpty() && columns.get(0).startsWith("\uFEFF")) {
            columns.set(0, columns.get(0).substring(1));
        }
        return columns;
    }

    private static String detectStack(Path evidenceDir) {
        Path absolute = evidenceDir.toAbsolutePath();
        Path root = absolute.getParent() != null ? absolute.getParent().getParent() : null;
        if (root != null && Files.exists(root.resolve("package.json"))) {
            return "javascript";
        }
        return "python";
    }

    private static EvidenceReport report(List<String> errors, List<String> missing, String stack, List<String> files) {
        int score = Math.max(0, 100 - errors.size() * 25 - missing.size() * 10);
        return new EvidenceReport(errors.isEmpty(), List.copyOf(errors), List.copyOf(missing), score, stack,
                List.copyOf(files));
    }
}
