package com.datapipe.orchestrator.service;

import com.datapipe.orchestrator.model.RunStatus;

/**
 * One status transition for a stage (stageName set) or for a whole pipeline
 * (stageName null).
 *
 * recordsProcessed is only applied by whole-pipeline updates; on stage
 * updates it travels along for reporters and logs.
 */
public record StatusUpdate(
        Long      pipelineId,
        String    stageName,
        RunStatus status,
        String    errorMessage,
        Long      recordsProcessed
) {

    public StatusUpdate {
        if (pipelineId == null) {
            throw new ValidationException("pipeline_id is required");
        }
        if (status == null) {
            throw new ValidationException("status is required");
        }
        if (recordsProcessed != null && recordsProcessed < 0) {
            throw new ValidationException("records_processed must not be negative: " + recordsProcessed);
        }
        if (stageName != null && stageName.isBlank()) stageName = null;
        if (errorMessage != null && errorMessage.isBlank()) errorMessage = null;
    }

    public static StatusUpdate forStage(Long pipelineId, String stageName, RunStatus status) {
        return new StatusUpdate(pipelineId, stageName, status, null, null);
    }

    public static StatusUpdate forStage(Long pipelineId, String stageName, RunStatus status,
                                        String errorMessage) {
        return new StatusUpdate(pipelineId, stageName, status, errorMessage, null);
    }

    public static StatusUpdate forPipeline(Long pipelineId, RunStatus status,
                                           String errorMessage, Long recordsProcessed) {
        return new StatusUpdate(pipelineId, null, status, errorMessage, recordsProcessed);
    }

    public StatusUpdate withRecordsProcessed(Long records) {
        return new StatusUpdate(pipelineId, stageName, status, errorMessage, records);
    }

    public boolean isStageUpdate() {
        return stageName != null;
    }
}
