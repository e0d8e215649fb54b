package com.datapipe.orchestrator.api.dto;

import com.datapipe.orchestrator.model.RunStatus;
import com.datapipe.orchestrator.model.Stage;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Read-only view of a stage, returned by GET /api/pipelines/{id}/stages and
 * nested in every PipelineResponse.
 */
public record StageResponse(
        Long      id,
        @JsonProperty("pipeline_id")            Long      pipelineId,
        String    name,
        String    description,
        RunStatus status,
        @JsonProperty("started_at")             Instant   startedAt,
        @JsonProperty("completed_at")           Instant   completedAt,
        @JsonProperty("execution_time_seconds") Double    executionTimeSeconds,
        @JsonProperty("error_message")          String    errorMessage
) {
    public static StageResponse from(Stage s) {
        return new StageResponse(
                s.getId(),
                s.getPipelineId(),
                s.getName(),
                s.getDescription(),
                s.getStatus(),
                s.getStartedAt(),
                s.getCompletedAt(),
                s.getExecutionTimeSeconds(),
                s.getErrorMessage()
        );
    }
}
