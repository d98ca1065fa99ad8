package com.growpad.core.patch;

import java.nio.file.Path;

/**
 * One named way of applying a unified diff to a working tree.
 * Implementations must leave the tree untouched when they report failure.
 */
public interface PatchStrategy {

    String name();

    Attempt apply(Path patchFile, Path targetDir);

    /**
     * @param applied whether the tree was changed
     * @param output  tool output, used for diagnostics and failure classification
     */
    record Attempt(boolean applied, String output) {}
}
