package com.flakedetector.orchestrator.model;

import java.util.Optional;

/**
 * A fully resolved flakiness-detection job, as handed to the pipeline.
 *
 * Defaults from repository configuration have already been merged by the caller.
 * The record is not validated on construction; JobRequestValidator does that so
 * the error can name the offending field.
 *
 * @param repo        remote URL with an allowed scheme prefix, or a local path
 * @param testCommand command line, tokenized without a shell
 * @param runs        number of repetitions, 1..1000
 * @param parallelism maximum concurrent runs, 1..50
 * @param framework   explicit framework; null means auto-detect
 */
public record JobRequest(
        String    repo,
        String    testCommand,
        int       runs,
        int       parallelism,
        Framework framework
) {
    public static final int DEFAULT_RUNS        = 10;
    public static final int DEFAULT_PARALLELISM = 4;

    public Optional<Framework> frameworkOverride() {
        return Optional.ofNullable(framework);
    }
}
