package com.flakedetector.orchestrator.service;

import com.flakedetector.orchestrator.model.Job;
import com.flakedetector.orchestrator.model.JobRequest;
import com.flakedetector.orchestrator.model.JobState;
import com.flakedetector.orchestrator.model.JobSummary;
import com.flakedetector.orchestrator.validation.JobRequestValidator;
import com.flakedetector.orchestrator.workspace.AcquisitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Job lifecycle for the REST adapter: submit, run in the background, poll.
 *
 * Jobs live in memory only, so callers can poll them while they run; the
 * oldest finished jobs are evicted once {@link #RETAINED_JOBS} is exceeded.
 * Requests are validated on the caller's thread so a bad request is rejected
 * immediately instead of surfacing later as a FAILED job.
 */
@Service
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    static final int RETAINED_JOBS = 500;

    private final Map<UUID, Job> jobs = new ConcurrentHashMap<>();

    private final FlakeDetectionService detectionService;
    private final JobRequestValidator   validator;
    private final Executor              jobExecutor;

    public JobService(FlakeDetectionService detectionService,
                      JobRequestValidator validator,
                      @Qualifier("jobExecutor") Executor jobExecutor) {
        this.detectionService = detectionService;
        this.validator        = validator;
        this.jobExecutor      = jobExecutor;
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /**
     * Validate the request and queue it for background execution.
     *
     * @throws com.flakedetector.orchestrator.validation.JobValidationException if the request is invalid
     */
    public Job submit(JobRequest request) {
        validator.validate(request);
        Job job = new Job(request);
        jobs.put(job.getId(), job);
        evictFinishedJobs();

        try {
            jobExecutor.execute(() -> runJob(job));
        } catch (RejectedExecutionException e) {
            log.error("Job {} rejected by the job pool", job.getId(), e);
            job.markFailed("Job could not be scheduled: " + e.getMessage());
        }
        log.info("Job {} queued: repo={} runs={} parallelism={}",
                job.getId(), request.repo(), request.runs(), request.parallelism());
        return job;
    }

    /**
     * Run a job on the caller's thread and return its summary.
     *
     * @throws com.flakedetector.orchestrator.validation.JobValidationException if the request is invalid
     * @throws AcquisitionException if the repository cannot be acquired
     */
    public JobSummary runNow(JobRequest request) {
        String tag = shortId(UUID.randomUUID());
        MDC.put("jobId", tag);
        try {
            return detectionService.detect(request, tag);
        } finally {
            MDC.remove("jobId");
        }
    }

    public Optional<Job> findById(UUID id) {
        return Optional.ofNullable(jobs.get(id));
    }

    // ------------------------------------------------------------------
    // Background execution
    // ------------------------------------------------------------------

    void runJob(Job job) {
        MDC.put("jobId", job.getId().toString());
        try {
            job.markRunning();
            log.info("Job {} started", job.getId());
            JobSummary summary = detectionService.detect(job.getRequest(), shortId(job.getId()));
            job.markDone(summary);
            log.info("Job {} DONE (severity={})", job.getId(), summary.severity());
        } catch (AcquisitionException e) {
            log.error("Job {} FAILED: {}", job.getId(), e.getMessage());
            job.markFailed(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Job {} FAILED with unexpected error", job.getId(), e);
            job.markFailed("Unexpected error: " + e.getMessage());
        } catch (Error e) {
            // Pollers must not see RUNNING forever; the error still reaches the pool thread.
            log.error("Job {} FAILED with fatal error", job.getId(), e);
            job.markFailed("Fatal error: " + e);
            throw e;
        } finally {
            MDC.remove("jobId");
        }
    }

    private void evictFinishedJobs() {
        int excess = jobs.size() - RETAINED_JOBS;
        if (excess <= 0) {
            return;
        }
        jobs.values().stream()
                .filter(j -> j.getState() == JobState.DONE || j.getState() == JobState.FAILED)
                .sorted(Comparator.comparing(Job::getUpdatedAt))
                .limit(excess)
                .map(Job::getId)
                .toList()
                .forEach(jobs::remove);
    }

    private static String shortId(UUID id) {
        return id.toString().substring(0, 8);
    }
}
