package com.datapipe.orchestrator.dataset;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Layout of the file written by the export stage.
 */
public record ExportDocument(
        @JsonProperty("pipeline_id")  Long       pipelineId,
        @JsonProperty("generated_at") String     generatedAt,
        @JsonProperty("record_count") int        recordCount,
        @JsonProperty("data")         List<Item> data) {}
