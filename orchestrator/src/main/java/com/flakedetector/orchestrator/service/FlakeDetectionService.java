package com.flakedetector.orchestrator.service;

import com.flakedetector.orchestrator.execution.ParallelExecutionEngine;
import com.flakedetector.orchestrator.framework.DependencyInstaller;
import com.flakedetector.orchestrator.framework.FrameworkDetector;
import com.flakedetector.orchestrator.model.Framework;
import com.flakedetector.orchestrator.model.JobRequest;
import com.flakedetector.orchestrator.model.JobSummary;
import com.flakedetector.orchestrator.model.RunResult;
import com.flakedetector.orchestrator.summary.ResultAggregator;
import com.flakedetector.orchestrator.validation.JobRequestValidator;
import com.flakedetector.orchestrator.workspace.RepositoryAcquirer;
import com.flakedetector.orchestrator.workspace.Workspace;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * The detection pipeline for one job:
 *
 * <pre>
 *   validate → acquire → detect framework → install deps → run N times → aggregate
 * </pre>
 *
 * Only two failures end a job without a summary: {@code JobValidationException}
 * (before any I/O) and {@code AcquisitionException}. Everything later is folded
 * into the summary. The workspace is deleted on every path out of the pipeline
 * once acquisition has succeeded.
 */
@Service
public class FlakeDetectionService {

    private static final Logger log = LoggerFactory.getLogger(FlakeDetectionService.class);

    private final JobRequestValidator     validator;
    private final RepositoryAcquirer      acquirer;
    private final FrameworkDetector       detector;
    private final DependencyInstaller     installer;
    private final ParallelExecutionEngine engine;
    private final ResultAggregator        aggregator;
    private final MeterRegistry           meterRegistry;

    public FlakeDetectionService(JobRequestValidator validator,
                                 RepositoryAcquirer acquirer,
                                 FrameworkDetector detector,
                                 DependencyInstaller installer,
                                 ParallelExecutionEngine engine,
                                 ResultAggregator aggregator,
                                 MeterRegistry meterRegistry) {
        this.validator     = validator;
        this.acquirer      = acquirer;
        this.detector      = detector;
        this.installer     = installer;
        this.engine        = engine;
        this.aggregator    = aggregator;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Run a job to completion on the calling thread.
     *
     * @param jobTag short identifier used in logs and the workspace directory name
     * @throws com.flakedetector.orchestrator.validation.JobValidationException if the request is invalid
     * @throws com.flakedetector.orchestrator.workspace.AcquisitionException if the repository cannot be acquired
     */
    public JobSummary detect(JobRequest request, String jobTag) {
        validator.validate(request);
        long started = System.nanoTime();

        try (Workspace workspace = acquirer.acquire(request.repo(), jobTag)) {
            Framework framework = detector.detect(workspace.root(), request.frameworkOverride());
            installer.install(framework, workspace.root());

            List<RunResult> results = engine.execute(
                    workspace.root(), request.testCommand(), request.runs(), request.parallelism(), framework);

            JobSummary summary = aggregator.aggregate(
                    request, framework, results, Duration.ofNanos(System.nanoTime() - started));

            meterRegistry.counter("flakedetector.job.completed",
                    "severity", summary.severity().name()).increment();
            log.info("Job finished: {}/{} runs failed, repro_rate={}, severity={}",
                    summary.failures(), summary.totalRuns(), summary.reproRate(), summary.severity());
            return summary;
        }
    }
}
