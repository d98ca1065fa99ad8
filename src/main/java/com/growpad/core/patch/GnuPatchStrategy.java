package com.growpad.core.patch;

import com.growpad.core.process.ProcessOutcome;
import com.growpad.core.process.ProcessRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * {@code patch -p1}, dry-run first. Tolerates fuzz that {@code git apply} rejects.
 */
@Component
@Order(2)
public class GnuPatchStrategy implements PatchStrategy {

    public static final String NAME = "gnu-patch";

    private final ProcessRunner processRunner;
    private final PatchProperties properties;

    public GnuPatchStrategy(ProcessRunner processRunner, PatchProperties properties) {
        this.processRunner = processRunner;
        this.properties = properties;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Attempt apply(Path patchFile, Path targetDir) {
        String file = patchFile.toAbsolutePath().toString();
        ProcessOutcome dryRun = processRunner.run(targetDir, properties.getTimeout(),
                List.of("patch", "-p1", "--batch", "--forward", "--dry-run", "-i", file));
        if (!dryRun.succeeded()) {
            return new Attempt(false, dryRun.stdout() + dryRun.stderr());
        }
        ProcessOutcome applied = processRunner.run(targetDir, properties.getTimeout(),
                List.of("patch", "-p1", "--batch", "--forward", "--no-backup-if-mismatch", "-i", file));
        return new Attempt(applied.succeeded(), applied.stdout() + applied.stderr());
    }
}
