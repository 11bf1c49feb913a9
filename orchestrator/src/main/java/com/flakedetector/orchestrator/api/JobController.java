package com.flakedetector.orchestrator.api;

import com.flakedetector.orchestrator.api.dto.JobResponse;
import com.flakedetector.orchestrator.api.dto.SubmitJobRequest;
import com.flakedetector.orchestrator.model.Job;
import com.flakedetector.orchestrator.model.JobSummary;
import com.flakedetector.orchestrator.service.JobService;
import com.flakedetector.orchestrator.validation.JobValidationException;
import com.flakedetector.orchestrator.workspace.AcquisitionException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;
import java.util.UUID;

/**
 * REST API for flaky-test detection jobs.
 *
 * POST /jobs              : validate and queue a job (202)
 * POST /jobs/run          : run a job synchronously and return its summary
 * GET  /jobs/{id}         : poll a queued job
 * GET  /jobs/{id}/summary : the job summary once the job is DONE
 */
@RestController
@RequestMapping("/jobs")
public class JobController {

    private final JobService jobService;

    public JobController(JobService jobService) {
        this.jobService = jobService;
    }

    /**
     * Queue a detection job.
     *
     * Example:
     *   curl -X POST http://localhost:8080/jobs \
     *     -H "Content-Type: application/json" \
     *     -d '{"repo":"https://github.com/org/repo.git","test_command":"pytest tests/test_flaky.py","runs":50,"parallelism":5}'
     */
    @PostMapping
    public ResponseEntity<JobResponse> submit(@RequestBody SubmitJobRequest req) {
        try {
            Job job = jobService.submit(req.toJobRequest());
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(JobResponse.from(job));
        } catch (JobValidationException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }

    /**
     * Run a job on the request thread. Intended for small run counts;
     * the connection stays open until every run has finished.
     *
     * HTTP 200: summary
     * HTTP 400: invalid request
     * HTTP 422: repository could not be cloned or copied
     */
    @PostMapping("/run")
    public JobSummary runNow(@RequestBody SubmitJobRequest req) {
        try {
            return jobService.runNow(req.toJobRequest());
        } catch (JobValidationException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        } catch (AcquisitionException e) {
            throw new ResponseStatusException(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage(), e);
        }
    }

    /**
     * Poll the current state of a job.
     * Returns 404 if the job ID is not found.
     */
    @GetMapping("/{id}")
    public JobResponse getJob(@PathVariable UUID id) {
        return JobResponse.from(findJob(id));
    }

    /**
     * HTTP 200: job is DONE, body is the summary
     * HTTP 202: job is still queued or running
     * HTTP 409: job FAILED before producing a summary
     * HTTP 404: job ID not found
     */
    @GetMapping("/{id}/summary")
    public ResponseEntity<?> getSummary(@PathVariable UUID id) {
        Job job = findJob(id);
        return switch (job.getState()) {
            case DONE -> ResponseEntity.ok(job.getSummary());
            case FAILED -> ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("state", job.getState().name(), "error", String.valueOf(job.getError())));
            case QUEUED, RUNNING -> ResponseEntity.accepted()
                    .body(Map.of("status", "pending", "state", job.getState().name()));
        };
    }

    private Job findJob(UUID id) {
        return jobService.findById(id).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Job not found: " + id));
    }
}
