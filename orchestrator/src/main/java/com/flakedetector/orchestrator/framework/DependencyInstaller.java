package com.flakedetector.orchestrator.framework;

import com.flakedetector.orchestrator.model.Framework;
import com.flakedetector.orchestrator.process.CommandOutcome;
import com.flakedetector.orchestrator.process.CommandRunner;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Best-effort, framework-specific dependency installation.
 *
 * Never throws for install problems: a failed or timed-out install is logged
 * as a warning and the job goes on, since the test command may not need
 * anything that failed to install.
 */
public class DependencyInstaller {

    private static final Logger log = LoggerFactory.getLogger(DependencyInstaller.class);

    // Longest stderr excerpt quoted in a warning.
    private static final int MAX_LOGGED_STDERR = 2000;

    private final CommandRunner runner;
    private final Duration      timeout;
    private final boolean       enabled;
    private final MeterRegistry meterRegistry;

    public DependencyInstaller(CommandRunner runner, Duration timeout, boolean enabled, MeterRegistry meterRegistry) {
        this.runner        = runner;
        this.timeout       = timeout;
        this.enabled       = enabled;
        this.meterRegistry = meterRegistry;
    }

    public InstallOutcome install(Framework framework, Path root) {
        InstallOutcome outcome = doInstall(framework, root);
        meterRegistry.counter("flakedetector.install.outcome",
                "framework", framework.wireName(),
                "outcome", outcome.name().toLowerCase()).increment();
        return outcome;
    }

    private InstallOutcome doInstall(Framework framework, Path root) {
        if (!enabled) {
            log.info("Dependency installation disabled, skipping");
            return InstallOutcome.SKIPPED;
        }
        if (framework.installCommand().isEmpty() || framework.manifestFile().isEmpty()) {
            log.info("Framework {} has no dependency installation configured", framework);
            return InstallOutcome.SKIPPED;
        }
        String manifest = framework.manifestFile().get();
        if (!Files.isRegularFile(root.resolve(manifest))) {
            log.info("No {} found, skipping dependency installation", manifest);
            return InstallOutcome.SKIPPED;
        }

        log.info("Installing {} dependencies: {}", framework, String.join(" ", framework.installCommand()));
        CommandOutcome outcome = runner.run(framework.installCommand(), root, timeout);

        if (outcome instanceof CommandOutcome.Completed done) {
            if (done.succeeded()) {
                log.info("Installed {} dependencies in {} ms", framework, done.elapsed().toMillis());
                return InstallOutcome.INSTALLED;
            }
            log.warn("Failed to install {} dependencies (exit {}), continuing: {}",
                    framework, done.exitCode(), excerpt(done.stderr()));
            return InstallOutcome.FAILED;
        }
        if (outcome instanceof CommandOutcome.TimedOut timedOut) {
            log.warn("Dependency installation timed out after {}s, continuing", timedOut.timeout().toSeconds());
            return InstallOutcome.TIMED_OUT;
        }
        CommandOutcome.LaunchFailed failed = (CommandOutcome.LaunchFailed) outcome;
        log.warn("Could not run {} install command, continuing: {}", framework, failed.message());
        return InstallOutcome.FAILED;
    }

    private static String excerpt(String stderr) {
        String s = stderr.strip();
        return s.length() <= MAX_LOGGED_STDERR ? s : s.substring(0, MAX_LOGGED_STDERR) + "...";
    }
}
