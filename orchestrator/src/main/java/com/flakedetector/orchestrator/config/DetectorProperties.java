package com.flakedetector.orchestrator.config;

import com.flakedetector.orchestrator.summary.SeverityThresholds;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Configuration properties for the detector, bound from {@code flakedetector.*}.
 *
 * Every value has a default, so an empty application.yml gives the stock
 * behaviour: 300 s bounds on clone, install and each run; https:// and git@
 * remotes; seeds drawn from [1, 1_000_000).
 */
@ConfigurationProperties(prefix = "flakedetector")
public record DetectorProperties(
        @DefaultValue({"https://", "git@"}) List<String> allowedSchemes,
        @DefaultValue Workspace  workspace,
        @DefaultValue Timeouts   timeouts,
        @DefaultValue Install    install,
        @DefaultValue Seed       seed,
        @DefaultValue Thresholds severity,
        @DefaultValue Execution  execution,
        @DefaultValue Jobs       jobs
) {

    public DetectorProperties {
        allowedSchemes = List.copyOf(allowedSchemes);
        if (allowedSchemes.isEmpty()) {
            throw new IllegalArgumentException("flakedetector.allowed-schemes must not be empty");
        }
    }

    /** The stock configuration, for wiring components by hand. */
    public static DetectorProperties defaults() {
        return new DetectorProperties(
                List.of("https://", "git@"),
                new Workspace("flaky-detector-", null),
                new Timeouts(Duration.ofSeconds(300), Duration.ofSeconds(300), Duration.ofSeconds(300)),
                new Install(true),
                new Seed(1, 1_000_000),
                new Thresholds(0.9, 0.5, 0.1, 0.0),
                new Execution(1_000_000),
                new Jobs(2));
    }

    // ------------------------------------------------------------------
    // Nested groups
    // ------------------------------------------------------------------

    /**
     * @param tempPrefix prefix of each job's ephemeral directory
     * @param baseDir    parent of the ephemeral directories; null means java.io.tmpdir
     */
    public record Workspace(
            @DefaultValue("flaky-detector-") String tempPrefix,
            String baseDir) {

        public Path resolveBaseDir() {
            return (baseDir == null || baseDir.isBlank())
                    ? Path.of(System.getProperty("java.io.tmpdir"))
                    : Path.of(baseDir);
        }
    }

    public record Timeouts(
            @DefaultValue("300s") Duration gitClone,
            @DefaultValue("300s") Duration install,
            @DefaultValue("300s") Duration run) {}

    public record Install(@DefaultValue("true") boolean enabled) {}

    /** Seeds are drawn from [min, max). */
    public record Seed(
            @DefaultValue("1")       int min,
            @DefaultValue("1000000") int max) {

        public Seed {
            if (min < 1 || max <= min) {
                throw new IllegalArgumentException(
                        "flakedetector.seed requires 1 <= min < max, got [%d, %d)".formatted(min, max));
            }
        }
    }

    public record Thresholds(
            @DefaultValue("0.9") double critical,
            @DefaultValue("0.5") double high,
            @DefaultValue("0.1") double medium,
            @DefaultValue("0.0") double low) {

        public Thresholds {
            // fail at startup rather than on the first classified job
            new SeverityThresholds(critical, high, medium, low);
        }

        public SeverityThresholds toSeverityThresholds() {
            return new SeverityThresholds(critical, high, medium, low);
        }
    }

    /** @param maxCapturedBytes per-stream cap on captured output in bytes; 0 disables the cap */
    public record Execution(@DefaultValue("1000000") int maxCapturedBytes) {}

    public record Jobs(@DefaultValue("2") int maxConcurrent) {

        public Jobs {
            if (maxConcurrent < 1) {
                throw new IllegalArgumentException("flakedetector.jobs.max-concurrent must be >= 1");
            }
        }
    }
}
