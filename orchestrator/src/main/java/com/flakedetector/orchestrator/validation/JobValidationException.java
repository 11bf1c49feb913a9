package com.flakedetector.orchestrator.validation;

/**
 * A job request field is missing, malformed or out of range.
 *
 * Thrown before the pipeline touches the network or the filesystem,
 * so nothing needs cleaning up.
 */
public class JobValidationException extends RuntimeException {

    private final String field;

    public JobValidationException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }

    /** Wire name of the offending field, e.g. "test_command". */
    public String getField() { return field; }
}
