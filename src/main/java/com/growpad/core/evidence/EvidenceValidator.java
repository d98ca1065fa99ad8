package com.growpad.core.evidence;

import java.nio.file.Path;

/**
 * Checks that an evidence bundle has the inputs synthesis needs.
 */
public interface EvidenceValidator {

    EvidenceReport validate(Path evidenceDir);
}
