package com.flakedetector.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Terminal artifact of a job: the failure distribution over all runs.
 *
 * results always holds exactly totalRuns entries, sorted by attempt.
 */
public record JobSummary(
        @JsonProperty("total_runs")  int             totalRuns,
        @JsonProperty("parallelism") int             parallelism,
        @JsonProperty("framework")   Framework       framework,
        @JsonProperty("failures")    int             failures,
        @JsonProperty("repro_rate")  double          reproRate,
        @JsonProperty("severity")    Severity        severity,
        @JsonProperty("elapsed_ms")  long            elapsedMs,
        @JsonProperty("results")     List<RunResult> results
) {
    public JobSummary {
        results = List.copyOf(results);
    }
}
