package com.growpad.core.patch;

import java.util.List;

/**
 * Outcome of {@link PatchApplier#apply}.
 *
 * @param applied       whether the tree now contains the change
 * @param filesModified paths named by the diff headers
 * @param strategy      name of the strategy that succeeded; null on failure
 * @param failure       failure kind; null on success
 * @param error         tool output or guard message explaining the failure
 */
public record PatchResult(
    boolean applied,
    List<String> filesModified,
    String strategy,
    PatchFailureKind failure,
    String error
) {

    static PatchResult success(List<String> files, String strategy) {
        return new PatchResult(true, List.copyOf(files), strategy, null, null);
    }

    static PatchResult failed(PatchFailureKind kind, List<String> files, String error) {
        return new PatchResult(false, List.copyOf(files), null, kind, error);
    }
}
