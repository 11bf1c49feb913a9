package com.flakedetector.orchestrator.framework;

/**
 * Result of the best-effort dependency installation step. Advisory only:
 * no value here stops a job or changes its severity.
 */
public enum InstallOutcome {
    /** Nothing to do: disabled, no install command, or no manifest file. */
    SKIPPED,
    INSTALLED,
    FAILED,
    TIMED_OUT
}
