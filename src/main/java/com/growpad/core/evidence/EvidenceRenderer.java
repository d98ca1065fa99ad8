package com.growpad.core.evidence;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Renders evidence files with line numbers so generated claims can cite line ranges.
 */
@Component
public class EvidenceRenderer {

    static final int MAX_LINES_PER_FILE = 200;

    public String render(Path evidenceDir, List<String> files) {
        StringBuilder out = new StringBuilder();
        for (String name : files) {
            Path file = evidenceDir.resolve(name);
            List<String> lines;
            try {
                lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read evidence file " + file, e);
            }
            out.append("### ").append(name).append('\n');
            int limit = Math.min(lines.size(), MAX_LINES_PER_FILE);
            for (int i = 0; i < limit; i++) {
                out.append(i + 1).append(": ").append(lines.get(i)).append('\n');
            }
            if (lines.size() > limit) {
                out.append("... (").append(lines.size() - limit).append(" more lines)\n");
            }
            out.append('\n');
        }
        return out.toString();
    }
}
