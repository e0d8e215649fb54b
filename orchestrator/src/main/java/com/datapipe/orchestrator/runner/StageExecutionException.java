package com.datapipe.orchestrator.runner;

/**
 * A stage body failed. Thrown by PipelineRunner after the failure has been
 * reported, so the caller sees the run as terminated.
 */
public class StageExecutionException extends RuntimeException {

    private final transient PipelineRun run;

    public StageExecutionException(PipelineRun run, String message, Throwable cause) {
        super("Stage '" + run.getCurrentStage() + "' of pipeline " + run.getPipelineId()
                + " failed: " + message, cause);
        this.run = run;
    }

    public PipelineRun getRun()       { return run; }
    public String      getStageName() { return run.getCurrentStage(); }
    public Long        getPipelineId() { return run.getPipelineId(); }
}
