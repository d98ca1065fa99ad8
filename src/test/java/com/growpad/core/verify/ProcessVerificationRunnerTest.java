package com.growpad.core.verify;

import com.growpad.core.process.ProcessOutcome;
import com.growpad.core.process.ProcessRunner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ProcessVerificationRunnerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    @TempDir
    Path tree;

    private ProcessRunner processRunner;
    private ProcessVerificationRunner runner;

    @BeforeEach
    void setUp() {
        processRunner = mock(ProcessRunner.class);
        VerificationProperties properties = new VerificationProperties();
        runner = new ProcessVerificationRunner(new CommandAllowlist(properties), processRunner, properties);
    }

    @Test
    @DisplayName("Denied command returns exit 2 without running anything")
    void deniedCommand() {
        VerificationResult result = runner.run(tree, "bash -c 'curl evil'", TIMEOUT);

        assertEquals(2, result.exitCode());
        assertEquals(VerificationResult.DENIED, result.summary());
        assertTrue(result.stderr().contains("not allowlisted"));
        verifyNoInteractions(processRunner);
    }

    @Nested
    @DisplayName("With a tests directory")
    class WithTests {

        @BeforeEach
        void writeTests() throws Exception {
            Files.createDirectories(tree.resolve("tests/unit"));
            Files.writeString(tree.resolve("tests/unit/test_app.py"), "def test_ok():\n    assert True\n");
        }

        @Test
        @DisplayName("Detects nested test files")
        void detectsTests() {
            assertTrue(runner.hasTests(tree));
        }

        @SuppressWarnings("unchecked")
        @Test
        @DisplayName("Runs pytest quietly with the command's extra arguments and src on PYTHONPATH")
        void runsPytest() {
            when(processRunner.run(any(Path.class), any(Duration.class), anyMap(), anyList()))
                    .thenReturn(new ProcessOutcome(0, "1 passed in 0.01s", "", 40, false));

            VerificationResult result = runner.run(tree, "pytest -k app", TIMEOUT);

            ArgumentCaptor<Map<String, String>> env = ArgumentCaptor.forClass(Map.class);
            ArgumentCaptor<List<String>> cmd = ArgumentCaptor.forClass(List.class);
            verify(processRunner).run(eq(tree), eq(TIMEOUT), env.capture(), cmd.capture());
            assertEquals(List.of("python3", "-m", "pytest", "-q", "-k", "app"), cmd.getValue());
            assertTrue(env.getValue().get("PYTHONPATH").endsWith("src"));
            assertTrue(result.passed());
            assertEquals(VerificationResult.PASS, result.summary());
        }

        @Test
        @DisplayName("Timeouts are reported as TIMEOUT")
        void timeout() {
            when(processRunner.run(any(Path.class), any(Duration.class), anyMap(), anyList()))
                    .thenReturn(new ProcessOutcome(ProcessRunner.TIMEOUT_EXIT_CODE, "", "Command timed out", 30000, true));

            VerificationResult result = runner.run(tree, "pytest", TIMEOUT);

            assertFalse(result.passed());
            assertEquals(VerificationResult.TIMEOUT, result.summary());
        }
    }

    @Nested
    @DisplayName("Without tests")
    class WithoutTests {

        @Test
        @DisplayName("No tests directory means no tests")
        void noTestsDir() {
            assertFalse(runner.hasTests(tree));
        }

        @Test
        @DisplayName("Falls back to compileall then a generated smoke test")
        void fallback() throws Exception {
            Files.createDirectories(tree.resolve("src/shop"));
            Files.writeString(tree.resolve("src/shop/__init__.py"), "");
            when(processRunner.run(any(Path.class), any(Duration.class), anyMap(), anyList()))
                    .thenReturn(new ProcessOutcome(0, "", "", 5, false))
                    .thenReturn(new ProcessOutcome(0, "1 passed", "", 9, false));

            VerificationResult result = runner.run(tree, "pytest", TIMEOUT);

            assertTrue(result.passed());
            assertTrue(result.stdout().contains("No tests detected"));
            String smoke = Files.readString(tree.resolve(ProcessVerificationRunner.SMOKE_TEST));
            assertTrue(smoke.contains("PACKAGES = [\"shop\"]"));
            verify(processRunner, times(2)).run(eq(tree), eq(TIMEOUT), anyMap(), anyList());
        }

        @Test
        @DisplayName("A failing compile stops before the smoke test")
        void compileFailure() {
            when(processRunner.run(any(Path.class), any(Duration.class), anyMap(), anyList()))
                    .thenReturn(new ProcessOutcome(1, "", "SyntaxError: invalid syntax", 5, false));

            VerificationResult result = runner.run(tree, "pytest", TIMEOUT);

            assertFalse(result.passed());
            assertEquals(VerificationResult.FAIL, result.summary());
            assertFalse(Files.exists(tree.resolve(ProcessVerificationRunner.SMOKE_TEST)));
            verify(processRunner, times(1)).run(any(Path.class), any(Duration.class), anyMap(), anyList());
        }
    }
}
