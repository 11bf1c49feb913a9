package com.flakedetector.orchestrator.model;

/**
 * How alarming a reproduction rate is. Thresholds live in SeverityThresholds.
 */
public enum Severity {
    /** Fails nearly every time: likely a real bug, not flakiness. */
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW,
    NONE
}
