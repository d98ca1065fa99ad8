package com.growpad.core.packaging;

import java.time.Instant;

/**
 * Integrity and provenance of one artifact file.
 */
public record ManifestEntry(
    String name,
    String sha256,
    long size,
    String stage,
    Instant timestamp
) {}
