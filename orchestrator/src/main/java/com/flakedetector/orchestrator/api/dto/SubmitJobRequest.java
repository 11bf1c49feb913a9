package com.flakedetector.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flakedetector.orchestrator.model.Framework;
import com.flakedetector.orchestrator.model.JobRequest;
import com.flakedetector.orchestrator.validation.JobValidationException;

/**
 * Request body for POST /jobs and POST /jobs/run.
 *
 * Required: repo, test_command
 * Optional: runs (default 10), parallelism (default 4), framework (auto-detected when absent)
 *
 * Range checks happen in JobRequestValidator, not here, so the error can name the field.
 * framework arrives as a plain string for the same reason: an unrecognised name is
 * rejected as a "framework" validation error instead of a generic parse failure.
 */
public record SubmitJobRequest(
        @JsonProperty("repo")         String    repo,
        @JsonProperty("test_command") String    testCommand,
        @JsonProperty("runs")         Integer   runs,
        @JsonProperty("parallelism")  Integer   parallelism,
        @JsonProperty("framework")    String    framework
) {
    // Compact constructor: fill in defaults for omitted counts.
    public SubmitJobRequest {
        if (runs == null)        runs        = JobRequest.DEFAULT_RUNS;
        if (parallelism == null) parallelism = JobRequest.DEFAULT_PARALLELISM;
    }

    /**
     * @throws JobValidationException if framework names no known framework
     */
    public JobRequest toJobRequest() {
        return new JobRequest(repo, testCommand, runs, parallelism, parseFramework());
    }

    private Framework parseFramework() {
        if (framework == null) {
            return null;
        }
        try {
            return Framework.fromWireName(framework);
        } catch (IllegalArgumentException e) {
            throw new JobValidationException("framework", e.getMessage());
        }
    }
}
