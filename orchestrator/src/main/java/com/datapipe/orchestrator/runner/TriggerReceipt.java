package com.datapipe.orchestrator.runner;

/**
 * Acknowledgement that a run was scheduled. The run itself continues in the
 * background; its outcome is visible through the pipeline's status.
 */
public record TriggerReceipt(Long pipelineId, String runId) {}
