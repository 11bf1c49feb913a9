package com.flakedetector.orchestrator.summary;

import com.flakedetector.orchestrator.model.Severity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SeverityClassifierTest {

    private final SeverityClassifier classifier = new SeverityClassifier(SeverityThresholds.DEFAULT);

    @ParameterizedTest
    @CsvSource({
            "1.0,   CRITICAL",
            "0.9,   CRITICAL",
            "0.899, HIGH",
            "0.5,   HIGH",
            "0.499, MEDIUM",
            "0.1,   MEDIUM",
            "0.099, LOW",
            "0.001, LOW",
            "0.0,   NONE"
    })
    void classify_defaultThresholds(double rate, Severity expected) {
        assertThat(classifier.classify(rate)).isEqualTo(expected);
    }

    @Test
    void classify_customLowThreshold_leavesTinyRatesAtNone() {
        SeverityClassifier strict = new SeverityClassifier(new SeverityThresholds(0.9, 0.5, 0.1, 0.01));

        assertThat(strict.classify(0.005)).isEqualTo(Severity.NONE);
        assertThat(strict.classify(0.01)).isEqualTo(Severity.LOW);
    }

    @Test
    void thresholds_outOfOrder_rejected() {
        assertThatThrownBy(() -> new SeverityThresholds(0.5, 0.9, 0.1, 0.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("critical >= high");
        assertThatThrownBy(() -> new SeverityThresholds(1.5, 0.5, 0.1, 0.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SeverityThresholds(0.9, 0.5, 0.1, -0.1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
