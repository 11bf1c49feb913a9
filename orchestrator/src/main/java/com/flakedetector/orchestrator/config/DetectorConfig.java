package com.flakedetector.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flakedetector.orchestrator.execution.ParallelExecutionEngine;
import com.flakedetector.orchestrator.execution.SeedSource;
import com.flakedetector.orchestrator.framework.DependencyInstaller;
import com.flakedetector.orchestrator.framework.FrameworkDetector;
import com.flakedetector.orchestrator.process.CommandRunner;
import com.flakedetector.orchestrator.summary.ResultAggregator;
import com.flakedetector.orchestrator.summary.SeverityClassifier;
import com.flakedetector.orchestrator.validation.JobRequestValidator;
import com.flakedetector.orchestrator.workspace.RepositoryAcquirer;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the pipeline components from {@link DetectorProperties}.
 *
 * The components themselves are plain classes so tests can build them by hand.
 */
@Configuration
@EnableConfigurationProperties(DetectorProperties.class)
public class DetectorConfig {

    @Bean
    CommandRunner commandRunner(DetectorProperties props) {
        return new CommandRunner(props.execution().maxCapturedBytes());
    }

    @Bean
    JobRequestValidator jobRequestValidator(DetectorProperties props) {
        return new JobRequestValidator(props.allowedSchemes());
    }

    @Bean
    RepositoryAcquirer repositoryAcquirer(CommandRunner runner, DetectorProperties props) {
        return new RepositoryAcquirer(runner,
                props.allowedSchemes(),
                props.workspace().resolveBaseDir(),
                props.workspace().tempPrefix(),
                props.timeouts().gitClone());
    }

    @Bean
    FrameworkDetector frameworkDetector(ObjectMapper objectMapper) {
        return new FrameworkDetector(objectMapper);
    }

    @Bean
    DependencyInstaller dependencyInstaller(CommandRunner runner, DetectorProperties props, MeterRegistry meterRegistry) {
        return new DependencyInstaller(runner, props.timeouts().install(), props.install().enabled(), meterRegistry);
    }

    @Bean
    SeedSource seedSource(DetectorProperties props) {
        return SeedSource.uniform(props.seed().min(), props.seed().max());
    }

    @Bean
    ParallelExecutionEngine parallelExecutionEngine(CommandRunner runner,
                                                    SeedSource seedSource,
                                                    DetectorProperties props,
                                                    MeterRegistry meterRegistry) {
        return new ParallelExecutionEngine(runner, seedSource, props.timeouts().run(), meterRegistry);
    }

    @Bean
    ResultAggregator resultAggregator(DetectorProperties props) {
        return new ResultAggregator(new SeverityClassifier(props.severity().toSeverityThresholds()));
    }

    /**
     * Bounded pool for asynchronously submitted jobs. Each job additionally
     * owns a run pool sized by its own parallelism. Spring calls shutdown() on close.
     */
    @Bean
    ExecutorService jobExecutor(DetectorProperties props) {
        return Executors.newFixedThreadPool(props.jobs().maxConcurrent(), new CustomizableThreadFactory("job-"));
    }
}
