package com.flakedetector.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of one repetition of the test command.
 *
 * exitCode is null when the process never produced one (timeout, launch failure,
 * worker fault); stderr then carries a marker describing why. seed is the value
 * injected for this run, so a failing run can be replayed; it is null only for
 * worker faults, where the task died before reporting it.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record RunResult(
        @JsonProperty("attempt")   int     attempt,
        @JsonProperty("seed")      Integer seed,
        @JsonProperty("exit_code") Integer exitCode,
        @JsonProperty("stdout")    String  stdout,
        @JsonProperty("stderr")    String  stderr,
        @JsonProperty("passed")    boolean passed
) {
    public static final String TIMEOUT_MARKER      = "TIMEOUT";
    public static final String ERROR_PREFIX        = "ERROR: ";
    public static final String WORKER_ERROR_PREFIX = "WORKER ERROR: ";

    public static RunResult completed(int attempt, int seed, int exitCode, String stdout, String stderr) {
        return new RunResult(attempt, seed, exitCode, stdout, stderr, exitCode == 0);
    }

    public static RunResult timedOut(int attempt, int seed) {
        return new RunResult(attempt, seed, null, "", TIMEOUT_MARKER, false);
    }

    public static RunResult launchFailed(int attempt, int seed, String message) {
        return new RunResult(attempt, seed, null, "", ERROR_PREFIX + message, false);
    }

    /** Synthesized when a task died before it could report anything itself. */
    public static RunResult workerFault(int attempt, String message) {
        return new RunResult(attempt, null, null, "", WORKER_ERROR_PREFIX + message, false);
    }
}
