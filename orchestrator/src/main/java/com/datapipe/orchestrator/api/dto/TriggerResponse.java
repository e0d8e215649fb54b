package com.datapipe.orchestrator.api.dto;

import com.datapipe.orchestrator.runner.TriggerReceipt;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Acknowledgement for POST /api/trigger and POST /api/trigger-pipeline.
 * The run continues in the background; poll GET /api/pipelines/{id}.
 */
public record TriggerResponse(
        boolean success,
        String  message,
        @JsonProperty("pipeline_id") Long   pipelineId,
        @JsonProperty("run_id")      String runId
) {
    public static TriggerResponse from(TriggerReceipt receipt) {
        return new TriggerResponse(true, "Pipeline " + receipt.pipelineId() + " triggered",
                receipt.pipelineId(), receipt.runId());
    }
}
