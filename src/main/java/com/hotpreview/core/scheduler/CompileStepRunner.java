package com.hotpreview.core.scheduler;

import com.hotpreview.core.model.CompileStep;
import com.hotpreview.core.model.RebuildJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Runs a project's compile step as an external process through the platform shell.
 * <p>
 * stdout and stderr are merged and captured up to {@code maxOutputBytes}; anything beyond
 * is drained and discarded. On timeout or cancellation the process tree is killed forcibly.
 */
public class CompileStepRunner implements RebuildStep {

    private static final Logger log = LoggerFactory.getLogger(CompileStepRunner.class);

    static final String TRUNCATION_MARKER = "\n... [output truncated]";

    private final CompileStep step;
    private final Path workingDir;
    private final int timeoutSeconds;
    private final int maxOutputBytes;

    public CompileStepRunner(CompileStep step, Path projectRoot, int defaultTimeoutSeconds, int maxOutputBytes) {
        this.step = step;
        this.workingDir = step.resolveWorkingDir(projectRoot);
        this.timeoutSeconds = step.timeoutSeconds() > 0 ? step.timeoutSeconds() : defaultTimeoutSeconds;
        this.maxOutputBytes = maxOutputBytes;
    }

    @Override
    public void execute(RebuildJob job, Cancellation cancellation) {
        if (!Files.isDirectory(workingDir)) {
            throw new BuildException("Compile working directory does not exist: " + workingDir, false);
        }
        List<String> command = shellCommand(step.command());
        log.info("Running compile step '{}' in {} (timeout {}s)", step.command(), workingDir, timeoutSeconds);

        Process process;
        try {
            process = new ProcessBuilder(command)
                    .directory(workingDir.toFile())
                    .redirectErrorStream(true)
                    .start();
        } catch (IOException e) {
            throw new BuildException("Failed to start compile step '" + step.command() + "': " + e.getMessage(), e);
        }
        cancellation.onCancel(() -> kill(process));

        var output = new BoundedCapture(maxOutputBytes);
        Thread drainer = new Thread(() -> output.drain(process.getInputStream()),
                "compile-output-" + job.projectId());
        drainer.setDaemon(true);
        drainer.start();

        boolean finished;
        try {
            finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            kill(process);
            throw new BuildException("Compile step interrupted", e);
        }

        if (!finished) {
            kill(process);
            awaitDrain(drainer);
            throw new BuildException(truncate("Compile step timed out after " + timeoutSeconds + "s\n"
                    + output.text(), maxOutputBytes), true);
        }
        awaitDrain(drainer);
        if (cancellation.isCancelled()) {
            log.debug("Compile step for job {} ended after cancellation", job.id());
            return;
        }

        int exitCode = process.exitValue();
        if (exitCode != 0) {
            throw new BuildException(truncate("Compile step exited with code " + exitCode + "\n"
                    + output.text(), maxOutputBytes), false);
        }
        log.debug("Compile step finished for job {}", job.id());
    }

    public int timeoutSeconds() {
        return timeoutSeconds;
    }

    static List<String> shellCommand(String commandLine) {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        if (os.contains("win")) {
            return List.of("cmd.exe", "/c", commandLine);
        }
        return List.of("sh", "-c", commandLine);
    }

    /**
     * Cuts {@code text} so its UTF-8 encoding fits within {@code maxBytes}, marker included.
     */
    static String truncate(String text, int maxBytes) {
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        if (bytes.length <= maxBytes) {
            return text;
        }
        int keep = Math.max(0, maxBytes - TRUNCATION_MARKER.length());
        // back off to a character boundary
        while (keep > 0 && (bytes[keep] & 0xC0) == 0x80) {
            keep--;
        }
        return new String(bytes, 0, keep, StandardCharsets.UTF_8) + TRUNCATION_MARKER;
    }

    private static void kill(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private static void awaitDrain(Thread drainer) {
        try {
            drainer.join(TimeUnit.SECONDS.toMillis(2));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /** Keeps the first {@code limit} bytes of a stream and discards the rest. */
    private static final class BoundedCapture {
        private final int limit;
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        private boolean truncated;

        BoundedCapture(int limit) {
            this.limit = limit;
        }

        void drain(InputStream in) {
            byte[] chunk = new byte[1024];
            try (in) {
                int n;
                while ((n = in.read(chunk)) != -1) {
                    append(chunk, n);
                }
            } catch (IOException e) {
                log.debug("Compile output stream closed: {}", e.getMessage());
            }
        }

        private synchronized void append(byte[] chunk, int n) {
            int room = limit - buffer.size();
            if (room > 0) {
                buffer.write(chunk, 0, Math.min(room, n));
            }
            if (n > room) {
                truncated = true;
            }
        }

        synchronized String text() {
            String captured = buffer.toString(StandardCharsets.UTF_8);
            return truncated ? captured + TRUNCATION_MARKER : captured;
        }
    }
}
