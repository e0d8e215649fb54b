package com.datapipe.orchestrator.api.dto;

import com.datapipe.orchestrator.model.RunStatus;
import com.datapipe.orchestrator.service.StatusUpdate;
import com.datapipe.orchestrator.service.ValidationException;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for POST /api/status-update.
 *
 * status is kept as the raw string so an unknown value becomes a 400 with
 * a readable message instead of a generic deserialization error.
 * Omit stage_name to update the pipeline itself.
 */
public record StatusUpdateRequest(
        @JsonProperty("pipeline_id")       Long   pipelineId,
        @JsonProperty("stage_name")        String stageName,
        @JsonProperty("status")            String status,
        @JsonProperty("error_message")     String errorMessage,
        @JsonProperty("records_processed") Long   recordsProcessed
) {
    public StatusUpdate toStatusUpdate() {
        RunStatus parsed;
        try {
            parsed = RunStatus.fromValue(status);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage(), e);
        }
        return new StatusUpdate(pipelineId, stageName, parsed, errorMessage, recordsProcessed);
    }
}
