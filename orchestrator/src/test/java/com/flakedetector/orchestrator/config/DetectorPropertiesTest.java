package com.flakedetector.orchestrator.config;

import com.flakedetector.orchestrator.summary.SeverityThresholds;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class DetectorPropertiesTest {

    @Configuration
    @EnableConfigurationProperties(DetectorProperties.class)
    static class PropertiesOnly {}

    private final ApplicationContextRunner runner =
            new ApplicationContextRunner().withUserConfiguration(PropertiesOnly.class);

    @Test
    void emptyConfiguration_bindsDefaults() {
        runner.run(ctx -> {
            DetectorProperties props = ctx.getBean(DetectorProperties.class);

            assertThat(props.allowedSchemes()).containsExactly("https://", "git@");
            assertThat(props.workspace().tempPrefix()).isEqualTo("flaky-detector-");
            assertThat(props.workspace().resolveBaseDir()).isEqualTo(Path.of(System.getProperty("java.io.tmpdir")));
            assertThat(props.timeouts().gitClone()).isEqualTo(Duration.ofSeconds(300));
            assertThat(props.timeouts().install()).isEqualTo(Duration.ofSeconds(300));
            assertThat(props.timeouts().run()).isEqualTo(Duration.ofSeconds(300));
            assertThat(props.install().enabled()).isTrue();
            assertThat(props.seed().min()).isEqualTo(1);
            assertThat(props.seed().max()).isEqualTo(1_000_000);
            assertThat(props.severity().toSeverityThresholds()).isEqualTo(SeverityThresholds.DEFAULT);
            assertThat(props.execution().maxCapturedBytes()).isEqualTo(1_000_000);
            assertThat(props.jobs().maxConcurrent()).isEqualTo(2);
            assertThat(props).isEqualTo(DetectorProperties.defaults());
        });
    }

    @Test
    void overrides_areBound() {
        runner.withPropertyValues(
                        "flakedetector.allowed-schemes=https://",
                        "flakedetector.workspace.base-dir=/var/tmp/flaky",
                        "flakedetector.timeouts.run=45s",
                        "flakedetector.timeouts.git-clone=90s",
                        "flakedetector.install.enabled=false",
                        "flakedetector.severity.critical=0.8",
                        "flakedetector.severity.low=0.05")
                .run(ctx -> {
                    DetectorProperties props = ctx.getBean(DetectorProperties.class);

                    assertThat(props.allowedSchemes()).containsExactly("https://");
                    assertThat(props.workspace().resolveBaseDir()).isEqualTo(Path.of("/var/tmp/flaky"));
                    assertThat(props.timeouts().run()).isEqualTo(Duration.ofSeconds(45));
                    assertThat(props.timeouts().gitClone()).isEqualTo(Duration.ofSeconds(90));
                    assertThat(props.timeouts().install()).isEqualTo(Duration.ofSeconds(300));
                    assertThat(props.install().enabled()).isFalse();
                    assertThat(props.severity().critical()).isEqualTo(0.8);
                    assertThat(props.severity().high()).isEqualTo(0.5);
                    assertThat(props.severity().low()).isEqualTo(0.05);
                });
    }

    @Test
    void misorderedThresholds_failStartup() {
        runner.withPropertyValues("flakedetector.severity.high=0.95")
                .run(ctx -> assertThat(ctx).hasFailed()
                        .getFailure().rootCause().hasMessageContaining("critical >= high"));
    }

    @Test
    void emptySeedRange_failsStartup() {
        runner.withPropertyValues("flakedetector.seed.min=10", "flakedetector.seed.max=10")
                .run(ctx -> assertThat(ctx).hasFailed());
    }
}
