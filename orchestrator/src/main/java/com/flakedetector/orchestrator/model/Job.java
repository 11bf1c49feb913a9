package com.flakedetector.orchestrator.model;

import java.time.Instant;
import java.util.UUID;

/**
 * One asynchronously submitted detection job.
 *
 * Held in memory by JobService so callers can poll it; nothing here is persisted.
 * The submitting thread creates it, a job-pool thread advances it, and request
 * threads read it, so mutable state is volatile and every transition bumps updatedAt.
 */
public class Job {

    private final UUID       id;
    private final JobRequest request;
    private final Instant    createdAt = Instant.now();

    private volatile JobState   state = JobState.QUEUED;
    private volatile JobSummary summary;
    private volatile String     error;
    private volatile Instant    updatedAt = createdAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    public Job(JobRequest request) {
        this(UUID.randomUUID(), request);
    }

    public Job(UUID id, JobRequest request) {
        this.id      = id;
        this.request = request;
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    public void markRunning() {
        this.state = JobState.RUNNING;
        touch();
    }

    public void markDone(JobSummary summary) {
        this.summary = summary;
        this.state   = JobState.DONE;
        touch();
    }

    public void markFailed(String error) {
        this.error = error;
        this.state = JobState.FAILED;
        touch();
    }

    private void touch() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public UUID       getId()        { return id; }
    public JobRequest getRequest()   { return request; }
    public JobState   getState()     { return state; }
    public JobSummary getSummary()   { return summary; }
    public String     getError()     { return error; }
    public Instant    getCreatedAt() { return createdAt; }
    public Instant    getUpdatedAt() { return updatedAt; }
}
