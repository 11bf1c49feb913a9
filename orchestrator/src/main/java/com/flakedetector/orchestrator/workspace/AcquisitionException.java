package com.flakedetector.orchestrator.workspace;

/**
 * The repository could not be materialized locally. Fatal to the job.
 *
 * The message carries the underlying cause text (git's stderr or the I/O error)
 * so callers can surface it unchanged.
 */
public class AcquisitionException extends RuntimeException {

    public enum Kind { CLONE_FAILED, CLONE_TIMED_OUT, INVALID_LOCAL_PATH, COPY_FAILED, WORKSPACE_ERROR }

    private final Kind kind;

    public AcquisitionException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public AcquisitionException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
