package com.datapipe.orchestrator.runner;

/**
 * The body of one pipeline stage.
 *
 * A task consumes the previous stage's output (or the RunParameters for the
 * first stage) and produces this stage's output. It does not report status
 * itself; PipelineRunner reports RUNNING before and COMPLETED/FAILED after
 * every invocation.
 *
 * <p>Implementations are collected by Spring and ordered by the
 * StageRegistry, matched on {@link #stageName()}.
 *
 * @param <I> input type (output type of the previous stage)
 * @param <O> output type
 */
public interface StageTask<I, O> {

    /** Registry name of the stage this task implements, e.g. "Data Ingestion". */
    String stageName();

    /**
     * Run the stage body. Any exception fails the stage and ends the run,
     * once the retry policy is used up.
     */
    O execute(I input, StageExecutionContext ctx) throws Exception;

    /** Record count reported with COMPLETED, or null if the stage has none. */
    default Long recordsProcessed(O output) {
        return null;
    }

    /** Attempts allowed for the body before the stage is reported FAILED. */
    default int maxAttempts() {
        return 1;
    }
}
