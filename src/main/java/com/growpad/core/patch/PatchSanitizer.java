package com.growpad.core.patch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Normalizes generated diff text into something {@code git apply} can read.
 */
@Component
public class PatchSanitizer {

    private static final Logger log = LoggerFactory.getLogger(PatchSanitizer.class);

    private static final String DIFF_HEADER = "diff --git ";

    private final PatchProperties properties;

    public PatchSanitizer(PatchProperties properties) {
        this.properties = properties;
    }

    /**
     * Strips code fences, normalizes line endings, splits a {@code diff --git} glued onto the
     * previous line, and drops sections for binary file types.
     *
     * @return the cleaned diff ending in a newline, or an empty string
     */
    public String sanitize(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        String text = raw.replace("\r\n", "\n").replace('\r', '\n');
        text = text.replaceAll("([^\\n])" + DIFF_HEADER, "$1\n" + DIFF_HEADER);

        List<String> lines = new ArrayList<>();
        for (String line : text.split("\n", -1)) {
            if (line.trim().startsWith("```")) {
                continue;
            }
            lines.add(line);
        }

        List<List<String>> sections = splitSections(lines);
        StringBuilder out = new StringBuilder();
        for (List<String> section : sections) {
            if (isBinarySection(section)) {
                log.warn("Dropping binary diff section: {}", section.get(0));
                continue;
            }
            List<String> trimmed = trimBlankEdges(section);
            if (trimmed.isEmpty()) {
                continue;
            }
            for (String line : trimmed) {
                out.append(line).append('\n');
            }
        }
        return out.toString();
    }

    /**
     * Whether the diff carries at least one file header.
     */
    public boolean hasFileHeaders(String diff) {
        for (String line : diff.split("\n")) {
            if (line.startsWith(DIFF_HEADER) || line.startsWith("+++ ") || line.startsWith("--- ")) {
                return true;
            }
        }
        return false;
    }

    /**
     * Target paths named by the diff headers: {@code +++ b/} lines, or {@code --- a/} for deletions.
     */
    public static List<String> touchedFiles(String diff) {
        Set<String> files = new LinkedHashSet<>();
        String lastOld = null;
        for (String line : diff.split("\n")) {
            if (line.startsWith("--- ")) {
                lastOld = stripPrefix(line.substring(4).trim(), "a/");
            } else if (line.startsWith("+++ ")) {
                String target = line.substring(4).trim();
                if (target.equals("/dev/null")) {
                    if (lastOld != null && !lastOld.equals("/dev/null")) {
                        files.add(lastOld);
                    }
                } else {
                    files.add(stripPrefix(target, "b/"));
                }
            }
        }
        return List.copyOf(files);
    }

    private static String stripPrefix(String path, String prefix) {
        int tab = path.indexOf('\t');
        String clean = tab >= 0 ? path.substring(0, tab) : path;
        return clean.startsWith(prefix) ? clean.substring(prefix.length()) : clean;
    }

    private List<List<String>> splitSections(List<String> lines) {
        List<List<String>> sections = new ArrayList<>();
        List<String> current = new ArrayList<>();
        for (String line : lines) {
            if (line.startsWith(DIFF_HEADER) && !current.isEmpty()) {
                sections.add(current);
                current = new ArrayList<>();
            }
            current.add(line);
        }
        if (!current.isEmpty()) {
            sections.add(current);
        }
        return sections;
    }

    private boolean isBinarySection(List<String> section) {
        for (String line : section) {
            if (line.startsWith("GIT binary patch") || (line.startsWith("Binary files ") && line.endsWith(" differ"))) {
                return true;
            }
            if (line.startsWith(DIFF_HEADER) || line.startsWith("+++ ") || line.startsWith("--- ")) {
                String lower = line.toLowerCase(Locale.ROOT).trim();
                for (String ext : properties.getBinaryExtensions()) {
                    if (lower.endsWith(ext.toLowerCase(Locale.ROOT))) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    private static List<String> trimBlankEdges(List<String> section) {
        int start = 0;
        int end = section.size();
        while (start < end && section.get(start).isBlank()) {
            start++;
        }
        while (end > start && section.get(end - 1).isEmpty()) {
            end--;
        }
        return section.subList(start, end);
    }
}
