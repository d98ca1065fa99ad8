package com.growpad.core.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Safety policy of a workspace.
 *
 * @param maxRetries     self-heal budget, 0..2; null means the default of 2
 * @param mode           READ_ONLY or PR; null means READ_ONLY
 * @param forbiddenPaths path prefixes a patch must never touch
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Guardrails(
    Integer maxRetries,
    WorkspaceMode mode,
    List<String> forbiddenPaths
) {

    public static final int RETRY_CEILING = 2;
    public static final List<String> DEFAULT_FORBIDDEN_PATHS = List.of("/infra", "/payments");

    public Guardrails {
        if (maxRetries == null) {
            maxRetries = RETRY_CEILING;
        }
        if (mode == null) {
            mode = WorkspaceMode.READ_ONLY;
        }
        forbiddenPaths = forbiddenPaths == null ? DEFAULT_FORBIDDEN_PATHS : List.copyOf(forbiddenPaths);
    }

    public static Guardrails defaults() {
        return new Guardrails(null, null, null);
    }

    /** The retry budget as consumed by the engine, never above {@link #RETRY_CEILING}. */
    public int effectiveMaxRetries() {
        return Math.max(0, Math.min(maxRetries, RETRY_CEILING));
    }
}
