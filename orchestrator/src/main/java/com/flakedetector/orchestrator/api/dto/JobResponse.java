package com.flakedetector.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flakedetector.orchestrator.model.Job;
import com.flakedetector.orchestrator.model.JobState;
import com.flakedetector.orchestrator.model.JobSummary;

import java.time.Instant;
import java.util.UUID;

/**
 * Response body for POST /jobs and GET /jobs/{id}.
 * summary is present once the job is DONE, error once it has FAILED.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(
        @JsonProperty("id")         UUID       id,
        @JsonProperty("state")      JobState   state,
        @JsonProperty("repo")       String     repo,
        @JsonProperty("created_at") Instant    createdAt,
        @JsonProperty("updated_at") Instant    updatedAt,
        @JsonProperty("error")      String     error,
        @JsonProperty("summary")    JobSummary summary
) {
    public static JobResponse from(Job job) {
        return new JobResponse(
                job.getId(),
                job.getState(),
                job.getRequest().repo(),
                job.getCreatedAt(),
                job.getUpdatedAt(),
                job.getError(),
                job.getSummary()
        );
    }
}
