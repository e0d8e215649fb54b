package com.datapipe.orchestrator.registry;

import java.util.List;
import java.util.Optional;

/**
 * The fixed, ordered list of stages every new pipeline is created with.
 *
 * Adding or removing a stage type is a change here only; the status update
 * protocol and the runner derive everything from this order.
 */
public class StageRegistry {

    public static final String DATA_GENERATION    = "Data Generation";
    public static final String DATA_INGESTION     = "Data Ingestion";
    public static final String SPARK_PROCESSING   = "Spark Processing";
    public static final String DBT_TRANSFORMATION = "DBT Transformation";
    public static final String DATA_EXPORT        = "Data Export";

    private static final List<StageDefinition> DEFAULT_STAGES = List.of(
            StageDefinition.of(DATA_GENERATION),
            StageDefinition.of(DATA_INGESTION),
            StageDefinition.of(SPARK_PROCESSING),
            StageDefinition.of(DBT_TRANSFORMATION),
            StageDefinition.of(DATA_EXPORT)
    );

    private final List<StageDefinition> stages;

    public StageRegistry(List<StageDefinition> stages) {
        if (stages.isEmpty()) {
            throw new IllegalArgumentException("A stage registry needs at least one stage");
        }
        long distinct = stages.stream()
                .map(d -> StageNames.normalize(d.name()).toLowerCase())
                .distinct()
                .count();
        if (distinct != stages.size()) {
            throw new IllegalArgumentException("Stage names must be unique ignoring case: " + stages);
        }
        this.stages = List.copyOf(stages);
    }

    public static StageRegistry defaultRegistry() {
        return new StageRegistry(DEFAULT_STAGES);
    }

    /** Stage definitions in execution order. */
    public List<StageDefinition> defaultStages() {
        return stages;
    }

    public int size() {
        return stages.size();
    }

    /** Look up a definition by raw or normalized name. */
    public Optional<StageDefinition> find(String name) {
        return stages.stream()
                .filter(d -> StageNames.matches(d.name(), name))
                .findFirst();
    }
}
