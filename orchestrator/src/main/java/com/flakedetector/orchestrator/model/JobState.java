package com.flakedetector.orchestrator.model;

/**
 * Lifecycle of an asynchronously submitted job.
 *
 * Transitions:
 *   QUEUED → RUNNING → DONE
 *
 * RUNNING can transition to FAILED when the repository cannot be acquired
 * or the job runner hits an unexpected error. Run failures never fail a job;
 * they are part of its summary.
 */
public enum JobState {
    QUEUED,
    RUNNING,
    DONE,
    FAILED
}
