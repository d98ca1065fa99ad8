package com.growpad.core.verify;

import com.growpad.core.process.ProcessOutcome;
import com.growpad.core.process.ProcessRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Verification through {@code python -m pytest}.
 * <p>
 * When the tree has no discoverable tests, falls back to a byte-compile of {@code src}
 * followed by a generated smoke test that imports each top-level package.
 */
@Service
public class ProcessVerificationRunner implements VerificationRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessVerificationRunner.class);

    static final String SMOKE_TEST = "tests/test_generated_smoke.py";

    private final CommandAllowlist allowlist;
    private final ProcessRunner processRunner;
    private final VerificationProperties properties;

    public ProcessVerificationRunner(CommandAllowlist allowlist, ProcessRunner processRunner,
                                     VerificationProperties properties) {
        this.allowlist = allowlist;
        this.processRunner = processRunner;
        this.properties = properties;
    }

    @Override
    public VerificationResult run(Path targetDir, String command, Duration timeout) {
        if (!allowlist.isAllowed(command)) {
            log.warn("Verification command denied: {}", command);
            return new VerificationResult("", "Command '" + command + "' not allowlisted", 2, 0,
                    VerificationResult.DENIED);
        }
        Map<String, String> env = Map.of("PYTHONPATH", targetDir.resolve("src").toAbsolutePath().toString());
        if (!hasTests(targetDir)) {
            return runFallback(targetDir, timeout, env);
        }

        List<String> cmd = new ArrayList<>(List.of(properties.getPythonExecutable(), "-m", "pytest", "-q"));
        String[] parts = command.trim().split("\\s+");
        cmd.addAll(Arrays.asList(parts).subList(1, parts.length));
        return toResult(processRunner.run(targetDir, timeout, env, cmd));
    }

    private VerificationResult runFallback(Path targetDir, Duration timeout, Map<String, String> env) {
        log.info("No tests matching {} in {}; running compile check and smoke test",
                properties.getTestGlob(), targetDir);
        long start = System.currentTimeMillis();
        ProcessOutcome compile = processRunner.run(targetDir, timeout, env,
                List.of(properties.getPythonExecutable(), "-m", "compileall", "-q", "src"));
        if (!compile.succeeded()) {
            return toResult(compile);
        }
        writeSmokeTest(targetDir);
        ProcessOutcome smoke = processRunner.run(targetDir, timeout, env,
                List.of(properties.getPythonExecutable(), "-m", "pytest", "-q", SMOKE_TEST));
        long duration = System.currentTimeMillis() - start;
        String stdout = compile.stdout()
                + "\nNo tests detected; executed compileall and generated smoke test.\n"
                + smoke.stdout();
        String stderr = (compile.stderr() + "\n" + smoke.stderr()).trim();
        return new VerificationResult(stdout, stderr, smoke.exitCode(), duration, summaryOf(smoke));
    }

    boolean hasTests(Path targetDir) {
        Path testsDir = targetDir.resolve("tests");
        if (!Files.isDirectory(testsDir)) {
            return false;
        }
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + properties.getTestGlob());
        PathMatcher direct = FileSystems.getDefault().getPathMatcher("glob:tests/test_*.py");
        try (Stream<Path> files = Files.walk(testsDir)) {
            return files.filter(Files::isRegularFile)
                    .map(targetDir::relativize)
                    .anyMatch(p -> matcher.matches(p) || direct.matches(p));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan " + testsDir, e);
        }
    }

    private void writeSmokeTest(Path targetDir) {
        List<String> packages = new ArrayList<>();
        Path src = targetDir.resolve("src");
        if (Files.isDirectory(src)) {
            try (Stream<Path> children = Files.list(src)) {
                children.filter(p -> Files.isRegularFile(p.resolve("__init__.py")))
                        .map(p -> p.getFileName().toString())
                        .sorted()
                        .forEach(packages::add);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to list " + src, e);
            }
        }
        StringBuilder body = new StringBuilder("import importlib\n\n\n");
        body.append("PACKAGES = [");
        for (int i = 0; i < packages.size(); i++) {
            body.append(i == 0 ? "" : ", ").append('"').append(packages.get(i)).append('"');
        }
        body.append("]\n\n\n");
        body.append("def test_generated_smoke_imports_packages() -> None:\n");
        body.append("    for name in PACKAGES:\n");
        body.append("        importlib.import_module(name)\n");
        try {
            Path file = targetDir.resolve(SMOKE_TEST);
            Files.createDirectories(file.getParent());
            Files.writeString(file, body.toString(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write smoke test", e);
        }
    }

    private static VerificationResult toResult(ProcessOutcome outcome) {
        return new VerificationResult(outcome.stdout(), outcome.stderr(), outcome.exitCode(),
                outcome.durationMs(), summaryOf(outcome));
    }

    private static String summaryOf(ProcessOutcome outcome) {
        if (outcome.timedOut()) {
            return VerificationResult.TIMEOUT;
        }
        return outcome.exitCode() == 0 ? VerificationResult.PASS : VerificationResult.FAIL;
    }
}
