package com.flakedetector.orchestrator.summary;

import com.flakedetector.orchestrator.model.Framework;
import com.flakedetector.orchestrator.model.JobRequest;
import com.flakedetector.orchestrator.model.JobSummary;
import com.flakedetector.orchestrator.model.RunResult;
import com.flakedetector.orchestrator.model.Severity;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;

/**
 * Folds the per-run results of a job into its {@link JobSummary}.
 *
 * Pure computation over results the engine has already collected.
 */
public class ResultAggregator {

    private final SeverityClassifier classifier;

    public ResultAggregator(SeverityClassifier classifier) {
        this.classifier = classifier;
    }

    /**
     * @throws IllegalStateException if the results do not cover every attempt exactly once
     */
    public JobSummary aggregate(JobRequest request, Framework framework,
                                List<RunResult> results, Duration elapsed) {
        List<RunResult> sorted = results.stream()
                .sorted(Comparator.comparingInt(RunResult::attempt))
                .toList();
        checkAttempts(sorted, request.runs());

        int failures = (int) sorted.stream().filter(r -> !r.passed()).count();
        double reproRate = reproRate(failures, request.runs());
        Severity severity = classifier.classify(reproRate);

        return new JobSummary(
                request.runs(),
                request.parallelism(),
                framework,
                failures,
                reproRate,
                severity,
                elapsed.toMillis(),
                sorted);
    }

    /** failures / totalRuns, rounded half-even to 3 decimal places. */
    public static double reproRate(int failures, int totalRuns) {
        if (totalRuns <= 0) {
            throw new IllegalArgumentException("totalRuns must be positive, got " + totalRuns);
        }
        return BigDecimal.valueOf(failures)
                .divide(BigDecimal.valueOf(totalRuns), 3, RoundingMode.HALF_EVEN)
                .doubleValue();
    }

    private static void checkAttempts(List<RunResult> sorted, int runs) {
        if (sorted.size() != runs) {
            throw new IllegalStateException(
                    "Expected %d run results, got %d".formatted(runs, sorted.size()));
        }
        for (int i = 0; i < runs; i++) {
            if (sorted.get(i).attempt() != i) {
                throw new IllegalStateException(
                        "Run results are not attempts 0..%d: position %d holds attempt %d"
                                .formatted(runs - 1, i, sorted.get(i).attempt()));
            }
        }
    }
}
