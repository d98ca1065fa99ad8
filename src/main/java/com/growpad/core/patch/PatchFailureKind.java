package com.growpad.core.patch;

/**
 * Why a patch was not applied.
 */
public enum PatchFailureKind {
    /** A header names a path under a forbidden prefix. Nothing was attempted. */
    FORBIDDEN_PATH,
    /** Empty, header-less or unparseable diff. */
    MALFORMED,
    /** Well-formed diff that does not apply to the current tree. */
    CONFLICT
}
