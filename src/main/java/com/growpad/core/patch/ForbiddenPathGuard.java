package com.growpad.core.patch;

import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Textual check of diff headers against forbidden path prefixes.
 * <p>
 * Every path-bearing header ({@code diff --git}, {@code ---}, {@code +++}, {@code Index:},
 * {@code rename from/to}, {@code copy from/to}) is read the way {@code git apply} and
 * {@code patch -p1} read it. C-style quoted names are unquoted, and {@code ./} and repeated
 * slashes are collapsed. Names that the tools strip with {@code -p1} are checked both as written
 * and with their first component dropped, whatever that component is called. Matching is a
 * plain prefix match with any leading {@code /} on the configured prefix ignored, so
 * {@code /infra} also blocks {@code infrastructure/}. A header whose path cannot be parsed, or
 * that climbs out of the tree with {@code ..}, is always reported.
 */
@Component
public class ForbiddenPathGuard {

    static final String UNPARSEABLE = "<unparseable header> ";

    private static final String DIFF_GIT = "diff --git ";
    private static final String[] STRIPPED_HEADERS = {"--- ", "+++ ", "Index: "};
    private static final String[] LITERAL_HEADERS = {"rename from ", "rename to ", "copy from ", "copy to "};
    private static final String DEV_NULL = "/dev/null";
    private static final Pattern HUNK_HEADER = Pattern.compile("^@@ -\\d+(?:,(\\d+))? \\+\\d+(?:,(\\d+))? @@");

    /**
     * @return offending header paths, empty when the diff is clean
     */
    public List<String> violations(String diff, List<String> forbiddenPaths) {
        if (forbiddenPaths == null || forbiddenPaths.isEmpty()) {
            return List.of();
        }
        List<String> prefixes = new ArrayList<>();
        for (String forbidden : forbiddenPaths) {
            String normalized = stripLeadingSlashes(forbidden.trim());
            if (!normalized.isEmpty()) {
                prefixes.add(normalized);
            }
        }
        if (prefixes.isEmpty()) {
            return List.of();
        }

        Set<String> offending = new LinkedHashSet<>();
        HunkCounter hunk = new HunkCounter();
        for (String line : diff.split("\n")) {
            if (hunk.consume(line)) {
                continue;
            }
            try {
                for (HeaderPath header : headerPaths(line)) {
                    String hit = match(header, prefixes);
                    if (hit != null) {
                        offending.add(hit);
                    }
                }
            } catch (UnparseablePathException e) {
                offending.add(UNPARSEABLE + line.trim());
            }
        }
        return List.copyOf(offending);
    }

    private static String match(HeaderPath header, List<String> prefixes) {
        List<String> candidates = new ArrayList<>();
        if (header.stripFirstComponent()) {
            int slash = header.path().indexOf('/');
            if (slash >= 0) {
                candidates.add(header.path().substring(slash + 1));
            }
        }
        candidates.add(header.path());
        for (String candidate : candidates) {
            for (String prefix : prefixes) {
                if (candidate.startsWith(prefix)) {
                    return candidate;
                }
            }
        }
        return null;
    }

    private static List<HeaderPath> headerPaths(String rawLine) {
        String line = rawLine.endsWith("\r") ? rawLine.substring(0, rawLine.length() - 1) : rawLine;
        List<HeaderPath> paths = new ArrayList<>();
        if (line.startsWith(DIFF_GIT)) {
            for (String token : diffGitTokens(line.substring(DIFF_GIT.length()).trim())) {
                paths.add(new HeaderPath(normalize(token), true));
            }
            return paths;
        }
        for (String header : STRIPPED_HEADERS) {
            if (line.startsWith(header)) {
                String raw = line.substring(header.length());
                String name = raw.startsWith("\"") ? unquote(raw).value() : stripTimestamp(raw);
                if (!name.equals(DEV_NULL)) {
                    paths.add(new HeaderPath(normalize(name), true));
                }
                return paths;
            }
        }
        for (String header : LITERAL_HEADERS) {
            if (line.startsWith(header)) {
                String raw = line.substring(header.length());
                String name = raw.startsWith("\"") ? unquote(raw).value() : raw.trim();
                paths.add(new HeaderPath(normalize(name), false));
                return paths;
            }
        }
        return paths;
    }

    /**
     * Both names of a {@code diff --git} line. Unquoted names may contain spaces, so every
     * whitespace-separated token is kept as a candidate too.
     */
    private static List<String> diffGitTokens(String rest) {
        List<String> tokens = new ArrayList<>();
        int i = 0;
        while (i < rest.length()) {
            char c = rest.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '"') {
                Unquoted unquoted = unquote(rest.substring(i));
                tokens.add(unquoted.value());
                i += unquoted.consumed();
            } else {
                int end = i;
                while (end < rest.length() && !Character.isWhitespace(rest.charAt(end))) {
                    end++;
                }
                tokens.add(rest.substring(i, end));
                i = end;
            }
        }
        if (tokens.isEmpty()) {
            throw new UnparseablePathException();
        }
        return tokens;
    }

    /** GNU diff separates an optional timestamp from the name with a tab. */
    private static String stripTimestamp(String raw) {
        int tab = raw.indexOf('\t');
        String name = (tab >= 0 ? raw.substring(0, tab) : raw).trim();
        if (name.isEmpty()) {
            throw new UnparseablePathException();
        }
        return name;
    }

    /**
     * Decodes a C-style quoted name as git writes it, starting at the opening quote.
     */
    static Unquoted unquote(String text) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        int i = 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '"') {
                return new Unquoted(bytes.toString(StandardCharsets.UTF_8), i + 1);
            }
            if (c != '\\') {
                byte[] encoded = String.valueOf(c).getBytes(StandardCharsets.UTF_8);
                bytes.write(encoded, 0, encoded.length);
                i++;
                continue;
            }
            if (i + 1 >= text.length()) {
                break;
            }
            char escaped = text.charAt(i + 1);
            switch (escaped) {
                case 'a' -> bytes.write(7);
                case 'b' -> bytes.write('\b');
                case 't' -> bytes.write('\t');
                case 'n' -> bytes.write('\n');
                case 'v' -> bytes.write(11);
                case 'f' -> bytes.write('\f');
                case 'r' -> bytes.write('\r');
                case '"', '\\' -> bytes.write(escaped);
                default -> {
                    if (escaped < '0' || escaped > '3' || i + 3 >= text.length()) {
                        throw new UnparseablePathException();
                    }
                    String octal = text.substring(i + 1, i + 4);
                    if (!octal.matches("[0-3][0-7]{2}")) {
                        throw new UnparseablePathException();
                    }
                    bytes.write(Integer.parseInt(octal, 8));
                    i += 4;
                    continue;
                }
            }
            i += 2;
        }
        throw new UnparseablePathException();
    }

    /**
     * Collapses {@code //} and {@code ./}, resolves {@code ..} and drops leading slashes.
     */
    static String normalize(String path) {
        if (path.isEmpty() || path.indexOf('\0') >= 0) {
            throw new UnparseablePathException();
        }
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : path.split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                if (segments.isEmpty()) {
                    throw new UnparseablePathException();
                }
                segments.removeLast();
                continue;
            }
            segments.addLast(segment);
        }
        if (segments.isEmpty()) {
            throw new UnparseablePathException();
        }
        return String.join("/", segments);
    }

    private static String stripLeadingSlashes(String path) {
        int i = 0;
        while (i < path.length() && path.charAt(i) == '/') {
            i++;
        }
        return path.substring(i);
    }

    /**
     * Tracks the body of the current hunk by its line counts, so removed or added content
     * lines such as {@code --- note} are never taken for headers.
     */
    private static final class HunkCounter {
        private int oldRemaining;
        private int newRemaining;

        /** @return true if the line belongs to a hunk (header or body) */
        boolean consume(String rawLine) {
            String line = rawLine.endsWith("\r") ? rawLine.substring(0, rawLine.length() - 1) : rawLine;
            if (oldRemaining > 0 || newRemaining > 0) {
                if (line.startsWith("\\")) {
                    return true;
                }
                char marker = line.isEmpty() ? ' ' : line.charAt(0);
                switch (marker) {
                    case ' ' -> { oldRemaining--; newRemaining--; }
                    case '-' -> oldRemaining--;
                    case '+' -> newRemaining--;
                    default -> {
                        oldRemaining = 0;
                        newRemaining = 0;
                        return false;
                    }
                }
                oldRemaining = Math.max(0, oldRemaining);
                newRemaining = Math.max(0, newRemaining);
                return true;
            }
            Matcher m = HUNK_HEADER.matcher(line);
            if (m.find()) {
                oldRemaining = m.group(1) == null ? 1 : Integer.parseInt(m.group(1));
                newRemaining = m.group(2) == null ? 1 : Integer.parseInt(m.group(2));
                return true;
            }
            return line.startsWith("\\");
        }
    }

    private record HeaderPath(String path, boolean stripFirstComponent) {}

    record Unquoted(String value, int consumed) {}

    private static final class UnparseablePathException extends RuntimeException {
        UnparseablePathException() {
            super(null, null, false, false);
        }
    }
}
