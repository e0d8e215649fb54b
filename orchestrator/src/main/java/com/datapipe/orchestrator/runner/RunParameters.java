package com.datapipe.orchestrator.runner;

/**
 * Input of the first stage.
 *
 * @param recordCount how many records the generation stage produces
 */
public record RunParameters(int recordCount) {

    public RunParameters {
        if (recordCount < 0) {
            throw new IllegalArgumentException("recordCount must not be negative: " + recordCount);
        }
    }
}
