package com.datapipe.orchestrator.api.dto;

/**
 * Request body for POST /api/pipelines.
 *
 * Required: name. Optional: description.
 */
public record CreatePipelineRequest(String name, String description) {}
