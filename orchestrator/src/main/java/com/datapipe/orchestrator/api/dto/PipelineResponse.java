package com.datapipe.orchestrator.api.dto;

import com.datapipe.orchestrator.model.Pipeline;
import com.datapipe.orchestrator.model.RunStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Response body for POST /api/pipelines, GET /api/pipelines and
 * GET /api/pipelines/{id}. Stages are nested in execution order.
 */
public record PipelineResponse(
        Long      id,
        String    name,
        String    description,
        RunStatus status,
        @JsonProperty("created_at")        Instant             createdAt,
        @JsonProperty("updated_at")        Instant             updatedAt,
        @JsonProperty("input_file")        String              inputFile,
        @JsonProperty("output_file")       String              outputFile,
        @JsonProperty("external_run_id")   String              externalRunId,
        @JsonProperty("records_processed") long                recordsProcessed,
        @JsonProperty("error_message")     String              errorMessage,
        List<StageResponse> stages
) {
    public static PipelineResponse from(Pipeline p) {
        return new PipelineResponse(
                p.getId(),
                p.getName(),
                p.getDescription(),
                p.getStatus(),
                p.getCreatedAt(),
                p.getUpdatedAt(),
                p.getInputFile(),
                p.getOutputFile(),
                p.getExternalRunId(),
                p.getRecordsProcessed(),
                p.getErrorMessage(),
                p.getStages().stream().map(StageResponse::from).toList()
        );
    }
}
