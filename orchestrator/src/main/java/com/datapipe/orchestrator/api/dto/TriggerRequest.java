package com.datapipe.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Request body for POST /api/trigger. */
public record TriggerRequest(@JsonProperty("pipeline_id") Long pipelineId) {}
