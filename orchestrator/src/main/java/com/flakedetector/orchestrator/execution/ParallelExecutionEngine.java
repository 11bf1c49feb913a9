package com.flakedetector.orchestrator.execution;

import com.flakedetector.orchestrator.model.Framework;
import com.flakedetector.orchestrator.model.RunResult;
import com.flakedetector.orchestrator.process.CommandOutcome;
import com.flakedetector.orchestrator.process.CommandRunner;
import com.flakedetector.orchestrator.process.CommandTokenizer;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs the test command {@code runs} times, at most {@code parallelism} at once,
 * and returns exactly {@code runs} results sorted by attempt.
 *
 * Each run gets its own seed and a private environment overlay
 * ({@code <seed variable>=<seed>}, {@code ATTEMPT=<index>}) and its own timeout;
 * a run that hangs is killed without affecting its siblings. Once started, a job
 * always runs every attempt to completion.
 *
 * No run failure escapes as an exception. Process outcomes become failing results
 * inside the task; anything that still escapes a task is turned into a synthetic
 * failing result for that attempt when it is collected.
 */
public class ParallelExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ParallelExecutionEngine.class);

    public static final String ATTEMPT_VARIABLE = "ATTEMPT";

    private final CommandRunner runner;
    private final SeedSource    seeds;
    private final Duration      runTimeout;
    private final MeterRegistry meterRegistry;

    public ParallelExecutionEngine(CommandRunner runner,
                                   SeedSource seeds,
                                   Duration runTimeout,
                                   MeterRegistry meterRegistry) {
        this.runner        = runner;
        this.seeds         = seeds;
        this.runTimeout    = runTimeout;
        this.meterRegistry = meterRegistry;
    }

    public List<RunResult> execute(Path workDir, String testCommand, int runs, int parallelism, Framework framework) {
        if (runs < 1 || parallelism < 1) {
            throw new IllegalArgumentException(
                    "runs and parallelism must be positive, got runs=%d parallelism=%d".formatted(runs, parallelism));
        }

        List<String> args;
        try {
            args = CommandTokenizer.tokenize(testCommand);
        } catch (IllegalArgumentException e) {
            // Validation rejects these; still keep one result per attempt.
            log.warn("Test command cannot be tokenized: {}", e.getMessage());
            List<RunResult> failed = new ArrayList<>(runs);
            for (int i = 0; i < runs; i++) {
                failed.add(RunResult.launchFailed(i, seeds.nextSeed(), e.getMessage()));
            }
            return failed;
        }

        log.info("Running {} x '{}' with parallelism {} (framework={}, timeout={}s)",
                runs, testCommand, parallelism, framework, runTimeout.toSeconds());

        ExecutorService pool = Executors.newFixedThreadPool(parallelism, new CustomizableThreadFactory("test-run-"));
        CompletionService<RunResult> completion = new ExecutorCompletionService<>(pool);
        Map<Future<RunResult>, Integer> attemptOf = new HashMap<>();
        Map<String, String> mdc = MDC.getCopyOfContextMap();

        List<RunResult> results = new ArrayList<>(runs);
        try {
            for (int i = 0; i < runs; i++) {
                final int attempt = i;
                attemptOf.put(completion.submit(() -> runOnce(args, workDir, framework, attempt, mdc)), attempt);
            }
            collect(completion, attemptOf, runs, results);
        } finally {
            pool.shutdownNow();
        }

        results.sort(Comparator.comparingInt(RunResult::attempt));
        long failures = results.stream().filter(r -> !r.passed()).count();
        log.info("Completed {} runs, {} failed", runs, failures);
        return results;
    }

    // ------------------------------------------------------------------
    // Collection
    // ------------------------------------------------------------------

    /** Waits for every submitted task, in completion order. */
    private void collect(CompletionService<RunResult> completion,
                         Map<Future<RunResult>, Integer> attemptOf,
                         int runs,
                         List<RunResult> results) {
        for (int collected = 0; collected < runs; collected++) {
            Future<RunResult> future;
            try {
                future = completion.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for runs, {} of {} collected", collected, runs);
                fillMissing(attemptOf, results, "interrupted while waiting for run");
                return;
            }
            int attempt = attemptOf.remove(future);
            try {
                results.add(future.get());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("Run {} failed inside the worker pool: {}", attempt, cause.toString());
                results.add(RunResult.workerFault(attempt, String.valueOf(cause.getMessage())));
            } catch (InterruptedException e) {
                // take() already returned a completed future; get() cannot block here.
                Thread.currentThread().interrupt();
                results.add(RunResult.workerFault(attempt, "interrupted"));
            }
        }
    }

    private static void fillMissing(Map<Future<RunResult>, Integer> attemptOf, List<RunResult> results, String reason) {
        attemptOf.forEach((future, attempt) -> {
            future.cancel(true);
            results.add(RunResult.workerFault(attempt, reason));
        });
        attemptOf.clear();
    }

    // ------------------------------------------------------------------
    // One run
    // ------------------------------------------------------------------

    private RunResult runOnce(List<String> args, Path workDir, Framework framework, int attempt,
                              Map<String, String> mdc) {
        if (mdc != null) {
            MDC.setContextMap(mdc);
        }
        MDC.put("attempt", String.valueOf(attempt));
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcomeTag = "error";
        try {
            int seed = seeds.nextSeed();
            Map<String, String> overlay = Map.of(
                    framework.seedVariable(), String.valueOf(seed),
                    ATTEMPT_VARIABLE,         String.valueOf(attempt));

            CommandOutcome outcome = runner.run(args, workDir, overlay, runTimeout);
            RunResult result = toRunResult(attempt, seed, outcome);

            if (outcome instanceof CommandOutcome.TimedOut) {
                outcomeTag = "timeout";
            } else if (outcome instanceof CommandOutcome.Completed) {
                outcomeTag = result.passed() ? "passed" : "failed";
            }
            log.debug("Run {} finished: seed={} exit={} passed={}",
                    attempt, seed, result.exitCode(), result.passed());
            return result;
        } finally {
            sample.stop(meterRegistry.timer("flakedetector.run.duration",
                    "framework", framework.wireName(), "outcome", outcomeTag));
            MDC.clear();
        }
    }

    static RunResult toRunResult(int attempt, int seed, CommandOutcome outcome) {
        if (outcome instanceof CommandOutcome.Completed done) {
            return RunResult.completed(attempt, seed, done.exitCode(), done.stdout(), done.stderr());
        }
        if (outcome instanceof CommandOutcome.TimedOut) {
            return RunResult.timedOut(attempt, seed);
        }
        CommandOutcome.LaunchFailed failed = (CommandOutcome.LaunchFailed) outcome;
        return RunResult.launchFailed(attempt, seed, failed.message());
    }
}
