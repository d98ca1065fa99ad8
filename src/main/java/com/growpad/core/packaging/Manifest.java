package com.growpad.core.packaging;

import java.util.List;

/**
 * Contents of {@code manifest.json}.
 *
 * @param artifacts one entry per artifact file, sorted by name
 * @param missing   required artifacts that were never produced
 */
public record Manifest(
    List<ManifestEntry> artifacts,
    List<String> missing
) {}
