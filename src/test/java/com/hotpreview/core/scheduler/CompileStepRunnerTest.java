package com.hotpreview.core.scheduler;

import com.hotpreview.core.model.CompileStep;
import com.hotpreview.core.model.RebuildJob;
import com.hotpreview.core.model.RebuildTrigger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CompileStepRunnerTest {

    @TempDir
    Path projectRoot;

    private static RebuildJob job() {
        return RebuildJob.queued("p1", RebuildTrigger.MANUAL, List.of()).running();
    }

    @Nested
    @DisabledOnOs(OS.WINDOWS)
    @DisplayName("execute")
    class ExecuteTests {

        @Test
        @DisplayName("a zero exit code is success")
        void success() throws Exception {
            var runner = new CompileStepRunner(new CompileStep("echo built > out.txt"), projectRoot, 10, 4096);
            runner.execute(job(), new Cancellation());
            assertEquals("built", Files.readString(projectRoot.resolve("out.txt")).trim());
        }

        @Test
        @DisplayName("a non-zero exit fails with the captured output")
        void nonZeroExit() {
            var runner = new CompileStepRunner(
                    new CompileStep("echo 'src/app.ts(3,1): error TS1005' >&2; exit 2"), projectRoot, 10, 4096);

            var ex = assertThrows(BuildException.class, () -> runner.execute(job(), new Cancellation()));
            assertFalse(ex.isTimedOut());
            assertTrue(ex.getMessage().startsWith("Compile step exited with code 2"));
            assertTrue(ex.getMessage().contains("error TS1005"));
        }

        @Test
        @DisplayName("a step that overruns its timeout is killed and reported as timed out")
        void timeout() {
            var runner = new CompileStepRunner(new CompileStep("sleep 5", null, 1), projectRoot, 30, 4096);

            long start = System.nanoTime();
            var ex = assertThrows(BuildException.class, () -> runner.execute(job(), new Cancellation()));
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertTrue(ex.isTimedOut());
            assertTrue(ex.getMessage().startsWith("Compile step timed out after 1s"));
            assertTrue(elapsedMs < 4500, "took " + elapsedMs + "ms");
        }

        @Test
        @DisplayName("large output is truncated to the configured bound")
        void outputTruncated() {
            var runner = new CompileStepRunner(
                    new CompileStep("i=0; while [ $i -lt 500 ]; do echo 'error line number '$i; i=$((i+1)); done; exit 1"),
                    projectRoot, 10, 512);

            var ex = assertThrows(BuildException.class, () -> runner.execute(job(), new Cancellation()));
            assertTrue(ex.getMessage().getBytes(StandardCharsets.UTF_8).length <= 512);
            assertTrue(ex.getMessage().endsWith(CompileStepRunner.TRUNCATION_MARKER));
        }

        @Test
        @DisplayName("a missing working directory fails before starting a process")
        void missingWorkingDir() {
            var runner = new CompileStepRunner(new CompileStep("true", Path.of("nope"), 0), projectRoot, 10, 4096);
            var ex = assertThrows(BuildException.class, () -> runner.execute(job(), new Cancellation()));
            assertTrue(ex.getMessage().contains("does not exist"));
        }

        @Test
        @DisplayName("cancellation kills the running process")
        void cancellationKills() throws Exception {
            var runner = new CompileStepRunner(new CompileStep("sleep 10"), projectRoot, 30, 4096);
            var cancellation = new Cancellation();

            var result = CompletableFuture.runAsync(() -> runner.execute(job(), cancellation));
            Thread.sleep(300);
            cancellation.cancel();

            assertDoesNotThrow(() -> result.get(5, TimeUnit.SECONDS));
        }
    }

    @Test
    @DisplayName("step timeout overrides the default")
    void timeoutResolution() {
        assertEquals(30, new CompileStepRunner(new CompileStep("true"), projectRoot, 30, 4096).timeoutSeconds());
        assertEquals(5, new CompileStepRunner(new CompileStep("true", null, 5), projectRoot, 30, 4096).timeoutSeconds());
    }

    @Test
    @DisplayName("truncate keeps short text and never splits a character")
    void truncate() {
        assertEquals("ok", CompileStepRunner.truncate("ok", 100));

        String text = "é".repeat(100);
        String cut = CompileStepRunner.truncate(text, 64);
        assertTrue(cut.getBytes(StandardCharsets.UTF_8).length <= 64);
        assertTrue(cut.endsWith(CompileStepRunner.TRUNCATION_MARKER));
        assertFalse(cut.contains("�"));
    }
}
