package com.flakedetector.orchestrator.service;

import com.flakedetector.orchestrator.model.Framework;
import com.flakedetector.orchestrator.model.Job;
import com.flakedetector.orchestrator.model.JobRequest;
import com.flakedetector.orchestrator.model.JobState;
import com.flakedetector.orchestrator.model.JobSummary;
import com.flakedetector.orchestrator.model.RunResult;
import com.flakedetector.orchestrator.model.Severity;
import com.flakedetector.orchestrator.validation.JobRequestValidator;
import com.flakedetector.orchestrator.validation.JobValidationException;
import com.flakedetector.orchestrator.workspace.AcquisitionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for JobService.
 *
 * The detection pipeline is mocked and the job pool is replaced by an executor
 * that only records tasks, so each test decides when a job actually runs.
 */
@ExtendWith(MockitoExtension.class)
class JobServiceTest {

    @Mock FlakeDetectionService detectionService;

    final JobRequestValidator validator = new JobRequestValidator(List.of("https://", "git@"));
    final List<Runnable> queued = new ArrayList<>();
    final Executor recordingExecutor = queued::add;

    JobService service;

    @BeforeEach
    void setUp() {
        service = new JobService(detectionService, validator, recordingExecutor);
    }

    private static JobRequest validRequest() {
        return new JobRequest("https://github.com/org/repo.git", "pytest tests/", 10, 4, null);
    }

    private static JobSummary summary() {
        return new JobSummary(1, 1, Framework.PYTHON, 0, 0.0, Severity.NONE, 10,
                List.of(RunResult.completed(0, 5, 0, "", "")));
    }

    // ------------------------------------------------------------------
    // submit()
    // ------------------------------------------------------------------

    @Test
    void submit_validRequest_queuesJob() {
        Job job = service.submit(validRequest());

        assertThat(job.getState()).isEqualTo(JobState.QUEUED);
        assertThat(queued).hasSize(1);
        assertThat(service.findById(job.getId())).contains(job);
        verifyNoInteractions(detectionService);
    }

    @Test
    void submit_invalidRequest_rejectedImmediately() {
        JobRequest bad = new JobRequest("https://github.com/org/repo.git", "pytest", 0, 4, null);

        assertThatThrownBy(() -> service.submit(bad)).isInstanceOf(JobValidationException.class);
        assertThat(queued).isEmpty();
    }

    @Test
    void submit_poolRejects_jobMarkedFailed() {
        service = new JobService(detectionService, validator, task -> {
            throw new java.util.concurrent.RejectedExecutionException("pool shut down");
        });

        Job job = service.submit(validRequest());

        assertThat(job.getState()).isEqualTo(JobState.FAILED);
        assertThat(job.getError()).contains("pool shut down");
    }

    // ------------------------------------------------------------------
    // Background execution
    // ------------------------------------------------------------------

    @Test
    void queuedJob_whenRun_isDoneWithSummary() {
        JobSummary summary = summary();
        when(detectionService.detect(any(), anyString())).thenReturn(summary);

        Job job = service.submit(validRequest());
        queued.get(0).run();

        assertThat(job.getState()).isEqualTo(JobState.DONE);
        assertThat(job.getSummary()).isSameAs(summary);
        assertThat(job.getError()).isNull();
        verify(detectionService).detect(job.getRequest(), job.getId().toString().substring(0, 8));
    }

    @Test
    void queuedJob_acquisitionFails_isFailedWithCause() {
        when(detectionService.detect(any(), anyString())).thenThrow(new AcquisitionException(
                AcquisitionException.Kind.CLONE_FAILED, "Failed to clone repository: fatal: not found"));

        Job job = service.submit(validRequest());
        queued.get(0).run();

        assertThat(job.getState()).isEqualTo(JobState.FAILED);
        assertThat(job.getError()).contains("CLONE_FAILED").contains("fatal: not found");
        assertThat(job.getSummary()).isNull();
    }

    @Test
    void queuedJob_unexpectedError_isFailedNotPropagated() {
        when(detectionService.detect(any(), anyString())).thenThrow(new IllegalStateException("bug"));

        Job job = service.submit(validRequest());
        queued.get(0).run();

        assertThat(job.getState()).isEqualTo(JobState.FAILED);
        assertThat(job.getError()).isEqualTo("Unexpected error: bug");
    }

    @Test
    void queuedJob_fatalError_isFailedAndRethrown() {
        when(detectionService.detect(any(), anyString())).thenThrow(new NoClassDefFoundError("com/example/Missing"));

        Job job = service.submit(validRequest());

        assertThatThrownBy(() -> queued.get(0).run()).isInstanceOf(NoClassDefFoundError.class);
        assertThat(job.getState()).isEqualTo(JobState.FAILED);
        assertThat(job.getError()).startsWith("Fatal error: ").contains("com/example/Missing");
    }

    // ------------------------------------------------------------------
    // runNow() / findById()
    // ------------------------------------------------------------------

    @Test
    void runNow_delegatesOnCallingThread() {
        JobSummary summary = summary();
        when(detectionService.detect(any(), anyString())).thenReturn(summary);

        assertThat(service.runNow(validRequest())).isSameAs(summary);
        assertThat(queued).isEmpty();
    }

    @Test
    void findById_unknown_isEmpty() {
        assertThat(service.findById(UUID.randomUUID())).isEmpty();
    }

    @Test
    void finishedJobs_areEvictedBeyondRetentionLimit() {
        when(detectionService.detect(any(), anyString())).thenReturn(summary());

        Job first = service.submit(validRequest());
        queued.get(0).run();
        for (int i = 0; i < JobService.RETAINED_JOBS; i++) {
            service.submit(validRequest());
        }

        assertThat(service.findById(first.getId())).isEmpty();
    }
}
