package com.growpad.core.patch;

import com.growpad.core.process.ProcessExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Applies a generated diff to the target working tree behind the forbidden-path guard.
 * <p>
 * Order of operations: sanitize, reject empty or header-less input, reject forbidden
 * paths, then try each configured {@link PatchStrategy} until one applies.
 */
@Service
public class PatchApplier {

    private static final Logger log = LoggerFactory.getLogger(PatchApplier.class);

    private static final List<String> MALFORMED_MARKERS = List.of(
            "corrupt patch", "malformed patch", "no valid patches", "only garbage",
            "patch fragment without header", "unrecognized input", "patch with only garbage");

    private final PatchSanitizer sanitizer;
    private final ForbiddenPathGuard guard;
    private final List<PatchStrategy> strategies;

    public PatchApplier(PatchSanitizer sanitizer, ForbiddenPathGuard guard,
                        List<PatchStrategy> availableStrategies, PatchProperties properties) {
        this.sanitizer = sanitizer;
        this.guard = guard;
        this.strategies = orderStrategies(availableStrategies, properties.getStrategies());
    }

    public PatchResult apply(String diffText, Path targetDir, List<String> forbiddenPaths) {
        String diff = sanitizer.sanitize(diffText);
        if (diff.isBlank() || !sanitizer.hasFileHeaders(diff)) {
            return PatchResult.failed(PatchFailureKind.MALFORMED, List.of(), "Patch is empty or has no file headers");
        }
        List<String> files = PatchSanitizer.touchedFiles(diff);

        List<String> violations = guard.violations(diff, forbiddenPaths);
        if (!violations.isEmpty()) {
            log.warn("Rejected patch touching forbidden paths: {}", violations);
            return PatchResult.failed(PatchFailureKind.FORBIDDEN_PATH, files,
                    "Patch touches forbidden paths: " + String.join(", ", violations));
        }

        Path patchFile = null;
        try {
            patchFile = Files.createTempFile("growpad-", ".patch");
            Files.writeString(patchFile, diff, StandardCharsets.UTF_8);

            StringBuilder errors = new StringBuilder();
            for (PatchStrategy strategy : strategies) {
                PatchStrategy.Attempt attempt;
                try {
                    attempt = strategy.apply(patchFile, targetDir);
                } catch (ProcessExecutionException e) {
                    attempt = new PatchStrategy.Attempt(false, e.getMessage());
                }
                if (attempt.applied()) {
                    log.info("Patch applied via {} ({} files)", strategy.name(), files.size());
                    return PatchResult.success(files, strategy.name());
                }
                log.warn("Strategy {} could not apply patch: {}", strategy.name(), firstLine(attempt.output()));
                errors.append('[').append(strategy.name()).append("] ").append(attempt.output().trim()).append('\n');
            }
            String error = errors.toString().trim();
            return PatchResult.failed(classify(error), files, error.isEmpty() ? "No patch strategy configured" : error);
        } catch (IOException e) {
            return PatchResult.failed(PatchFailureKind.CONFLICT, files, "Could not stage patch file: " + e.getMessage());
        } finally {
            if (patchFile != null) {
                try {
                    Files.deleteIfExists(patchFile);
                } catch (IOException e) {
                    log.debug("Could not delete {}: {}", patchFile, e.getMessage());
                }
            }
        }
    }

    public List<String> strategyNames() {
        return strategies.stream().map(PatchStrategy::name).toList();
    }

    static PatchFailureKind classify(String toolOutput) {
        String lower = toolOutput.toLowerCase(Locale.ROOT);
        for (String marker : MALFORMED_MARKERS) {
            if (lower.contains(marker)) {
                return PatchFailureKind.MALFORMED;
            }
        }
        return PatchFailureKind.CONFLICT;
    }

    private static List<PatchStrategy> orderStrategies(List<PatchStrategy> available, List<String> order) {
        Map<String, PatchStrategy> byName = new LinkedHashMap<>();
        for (PatchStrategy strategy : available) {
            byName.put(strategy.name(), strategy);
        }
        if (order == null || order.isEmpty()) {
            return List.copyOf(byName.values());
        }
        List<PatchStrategy> ordered = new ArrayList<>();
        for (String name : order) {
            PatchStrategy strategy = byName.get(name);
            if (strategy == null) {
                throw new IllegalStateException("Unknown patch strategy: " + name);
            }
            ordered.add(strategy);
        }
        return List.copyOf(ordered);
    }

    private static String firstLine(String text) {
        String trimmed = text.trim();
        int newline = trimmed.indexOf('\n');
        return newline < 0 ? trimmed : trimmed.substring(0, newline);
    }
}
