package com.datapipe.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Status shared by pipelines and their stages.
 *
 * Transitions for a stage:
 *   PENDING → RUNNING → COMPLETED
 *   any     → FAILED
 *
 * A pipeline follows the same path, but its COMPLETED/FAILED states are
 * derived from stage outcomes by StatusUpdateService and are final.
 *
 * On the wire the values are lowercase ("pending", "running", ...).
 */
public enum RunStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Parse a wire value, case-insensitively.
     *
     * @throws IllegalArgumentException for null, blank or unknown values
     */
    @JsonCreator
    public static RunStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Status must not be empty");
        }
        for (RunStatus s : values()) {
            if (s.name().equalsIgnoreCase(value.trim())) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown status '" + value
                + "', expected one of pending, running, completed, failed");
    }
}
