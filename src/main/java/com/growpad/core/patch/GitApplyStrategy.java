package com.growpad.core.patch;

import com.growpad.core.process.ProcessOutcome;
import com.growpad.core.process.ProcessRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * {@code git apply} with whitespace tolerance. Checks first so a partial apply never happens.
 */
@Component
@Order(1)
public class GitApplyStrategy implements PatchStrategy {

    public static final String NAME = "git-apply";

    private final ProcessRunner processRunner;
    private final PatchProperties properties;

    public GitApplyStrategy(ProcessRunner processRunner, PatchProperties properties) {
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
        ProcessOutcome check = processRunner.run(targetDir, properties.getTimeout(),
                List.of("git", "apply", "--check", "--ignore-space-change", "--ignore-whitespace", file));
        if (!check.succeeded()) {
            return new Attempt(false, check.stdout() + check.stderr());
        }
        ProcessOutcome applied = processRunner.run(targetDir, properties.getTimeout(),
                List.of("git", "apply", "--ignore-space-change", "--ignore-whitespace", file));
        return new Attempt(applied.succeeded(), applied.stdout() + applied.stderr());
    }
}
