package com.growpad.core.model;

/**
 * Whether a run only produces artifacts or also prepares a pull request note.
 */
public enum WorkspaceMode {
    READ_ONLY,
    PR
}
