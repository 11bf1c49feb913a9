package com.flakedetector.orchestrator.summary;

import com.flakedetector.orchestrator.model.Severity;

/**
 * Maps a reproduction rate onto a {@link Severity} tier.
 */
public class SeverityClassifier {

    private final SeverityThresholds thresholds;

    public SeverityClassifier(SeverityThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public Severity classify(double reproRate) {
        if (reproRate >= thresholds.critical()) return Severity.CRITICAL;
        if (reproRate >= thresholds.high())     return Severity.HIGH;
        if (reproRate >= thresholds.medium())   return Severity.MEDIUM;
        if (reproRate > 0.0 && reproRate >= thresholds.low()) return Severity.LOW;
        return Severity.NONE;
    }
}
