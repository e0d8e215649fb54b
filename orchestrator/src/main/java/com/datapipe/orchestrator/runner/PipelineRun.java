package com.datapipe.orchestrator.runner;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * In-memory state of one run, owned by the thread executing it.
 * The persisted status lives in the store; this tracks where the runner is.
 */
public class PipelineRun {

    private final Long   pipelineId;
    private final String runId;

    private RunPhase     phase = RunPhase.NOT_STARTED;
    private String       currentStage;
    private Long         recordsProcessed;
    private final List<String> completedStages = new ArrayList<>();

    public PipelineRun(Long pipelineId, String runId) {
        this.pipelineId = pipelineId;
        this.runId      = runId;
    }

    void enterStage(String stageName) {
        if (phase != RunPhase.NOT_STARTED && phase != RunPhase.RUNNING) {
            throw new IllegalStateException("Run " + runId + " is " + phase + ", cannot start stage " + stageName);
        }
        phase        = RunPhase.RUNNING;
        currentStage = stageName;
    }

    void stageCompleted(Long records) {
        completedStages.add(currentStage);
        if (records != null) {
            recordsProcessed = records;
        }
    }

    void complete() {
        phase        = RunPhase.COMPLETED;
        currentStage = null;
    }

    // currentStage keeps pointing at the stage that failed.
    void fail() {
        phase = RunPhase.FAILED;
    }

    public Long         getPipelineId()       { return pipelineId; }
    public String       getRunId()            { return runId; }
    public RunPhase     getPhase()            { return phase; }
    public String       getCurrentStage()     { return currentStage; }
    public Long         getRecordsProcessed() { return recordsProcessed; }
    public List<String> getCompletedStages()  { return Collections.unmodifiableList(completedStages); }
}
