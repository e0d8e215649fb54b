package com.datapipe.orchestrator.service;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Outcome of applying a StatusUpdate. Unknown ids are results, not exceptions.
 */
public enum StatusUpdateResult {
    UPDATED,
    PIPELINE_NOT_FOUND,
    STAGE_NOT_FOUND;

    public boolean isSuccess() {
        return this == UPDATED;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static StatusUpdateResult fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
