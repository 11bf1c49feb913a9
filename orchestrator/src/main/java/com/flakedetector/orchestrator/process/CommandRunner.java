package com.flakedetector.orchestrator.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs one external command with a wall-clock bound and captures its output.
 *
 * The argument list goes straight to {@link ProcessBuilder}; no shell is involved.
 * The child's environment is the JVM's environment plus {@code envOverrides};
 * the JVM's own environment is never modified. stdout and stderr are redirected
 * to private temp files rather than pipes, so a chatty process cannot block on a
 * full pipe and a killed process cannot leave a reader hanging.
 *
 * Safe to call from many threads at once.
 */
public class CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(CommandRunner.class);

    // Grace period for a killed process tree to actually exit.
    private static final Duration KILL_GRACE = Duration.ofSeconds(10);

    private final int maxCapturedBytes;

    /** @param maxCapturedBytes per-stream capture limit; 0 means unlimited */
    public CommandRunner(int maxCapturedBytes) {
        if (maxCapturedBytes < 0) {
            throw new IllegalArgumentException("maxCapturedBytes must be >= 0");
        }
        this.maxCapturedBytes = maxCapturedBytes;
    }

    public CommandOutcome run(List<String> command, Path workingDir, Duration timeout) {
        return run(command, workingDir, Map.of(), timeout);
    }

    /**
     * Launch {@code command} in {@code workingDir} and wait for it, at most {@code timeout}.
     */
    public CommandOutcome run(List<String> command,
                              Path workingDir,
                              Map<String, String> envOverrides,
                              Duration timeout) {
        if (command.isEmpty()) {
            return new CommandOutcome.LaunchFailed("empty command");
        }

        Path stdoutFile = null;
        Path stderrFile = null;
        Process process = null;
        try {
            stdoutFile = Files.createTempFile("flaky-detector-", ".stdout");
            stderrFile = Files.createTempFile("flaky-detector-", ".stderr");

            ProcessBuilder pb = new ProcessBuilder(command)
                    .directory(workingDir.toFile())
                    .redirectInput(ProcessBuilder.Redirect.from(nullDevice()))
                    .redirectOutput(stdoutFile.toFile())
                    .redirectError(stderrFile.toFile());
            pb.environment().putAll(envOverrides);

            long started = System.nanoTime();
            process = pb.start();
            boolean exited = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - started);

            if (!exited) {
                log.debug("Command {} exceeded {}s, killing process tree", command.get(0), timeout.toSeconds());
                killTree(process);
                return new CommandOutcome.TimedOut(timeout, readCapped(stdoutFile), readCapped(stderrFile));
            }
            return new CommandOutcome.Completed(
                    process.exitValue(), readCapped(stdoutFile), readCapped(stderrFile), elapsed);

        } catch (IOException e) {
            return new CommandOutcome.LaunchFailed(e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (process != null) {
                killTree(process);
            }
            return new CommandOutcome.LaunchFailed("interrupted");
        } finally {
            deleteQuietly(stdoutFile);
            deleteQuietly(stderrFile);
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private String readCapped(Path file) throws IOException {
        if (maxCapturedBytes == 0) {
            return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        }
        long size = Files.size(file);
        try (InputStream in = Files.newInputStream(file)) {
            byte[] bytes = in.readNBytes(maxCapturedBytes);
            String text = new String(bytes, StandardCharsets.UTF_8);
            if (size > maxCapturedBytes) {
                text += "\n[output truncated: " + size + " bytes, kept " + maxCapturedBytes + "]";
            }
            return text;
        }
    }

    private static void killTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            if (!process.waitFor(KILL_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Process {} did not exit within {}s of being killed",
                        process.pid(), KILL_GRACE.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) return;
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete capture file {}: {}", file, e.getMessage());
        }
    }

    private static java.io.File nullDevice() {
        return new java.io.File(System.getProperty("os.name").startsWith("Windows") ? "NUL" : "/dev/null");
    }
}
