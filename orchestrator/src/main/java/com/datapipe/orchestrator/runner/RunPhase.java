package com.datapipe.orchestrator.runner;

/**
 * Phase of a single pipeline run.
 *
 *   NOT_STARTED → RUNNING (stage 1) → RUNNING (stage 2) → ... → COMPLETED
 *   RUNNING (stage i) → FAILED   (terminal, no resumption)
 */
public enum RunPhase {
    NOT_STARTED,
    RUNNING,
    COMPLETED,
    FAILED
}
