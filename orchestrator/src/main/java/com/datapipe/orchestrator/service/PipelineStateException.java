package com.datapipe.orchestrator.service;

import com.datapipe.orchestrator.model.RunStatus;

/**
 * Thrown when an operation is not allowed in the pipeline's current status,
 * e.g. triggering a pipeline that already ran.
 */
public class PipelineStateException extends RuntimeException {

    private final Long      pipelineId;
    private final RunStatus status;

    public PipelineStateException(Long pipelineId, RunStatus status, String message) {
        super(message);
        this.pipelineId = pipelineId;
        this.status     = status;
    }

    public Long      getPipelineId() { return pipelineId; }
    public RunStatus getStatus()     { return status; }
}
