package com.flakedetector.orchestrator.summary;

/**
 * Inclusive lower bounds of each severity tier.
 *
 * A rate equal to a bound belongs to the higher tier. {@code low} only applies
 * to non-zero rates: a rate of exactly 0.0 is always NONE.
 */
public record SeverityThresholds(double critical, double high, double medium, double low) {

    public static final SeverityThresholds DEFAULT = new SeverityThresholds(0.9, 0.5, 0.1, 0.0);

    public SeverityThresholds {
        if (!(critical <= 1.0 && critical >= high && high >= medium && medium >= low && low >= 0.0)) {
            throw new IllegalArgumentException(
                    "Severity thresholds must satisfy 1 >= critical >= high >= medium >= low >= 0, got "
                    + "critical=%s high=%s medium=%s low=%s".formatted(critical, high, medium, low));
        }
    }
}
