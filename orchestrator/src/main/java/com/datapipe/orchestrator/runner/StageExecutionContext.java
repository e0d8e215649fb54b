package com.datapipe.orchestrator.runner;

/**
 * What a stage body knows about the run it belongs to.
 */
public record StageExecutionContext(Long pipelineId, String runId, String stageName) {}
