package com.datapipe.orchestrator.registry;

/**
 * Name and description of one stage in the pipeline sequence.
 */
public record StageDefinition(String name, String description) {

    public static StageDefinition of(String name) {
        return new StageDefinition(name, "Pipeline stage: " + name);
    }
}
