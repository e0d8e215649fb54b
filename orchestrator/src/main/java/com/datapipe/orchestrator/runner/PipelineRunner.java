package com.datapipe.orchestrator.runner;

import com.datapipe.orchestrator.config.OrchestratorConfig;
import com.datapipe.orchestrator.model.RunStatus;
import com.datapipe.orchestrator.registry.StageDefinition;
import com.datapipe.orchestrator.registry.StageNames;
import com.datapipe.orchestrator.registry.StageRegistry;
import com.datapipe.orchestrator.reporter.ResilientStatusReporter;
import com.datapipe.orchestrator.service.StatusUpdate;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.support.RetryTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Executes a pipeline's stages one after the other, in registry order.
 *
 * For every stage:
 *   1. report RUNNING
 *   2. run the body (with the task's own retry policy) on the previous output
 *   3. report COMPLETED with the stage's record count, or
 *      report FAILED with the error and throw StageExecutionException
 *
 * The first failure ends the run; later stages are never started. After the
 * last stage a whole-pipeline COMPLETED is reported with the final record
 * count. Pipeline status is never written here directly: every change goes
 * through the status update protocol via the reporter.
 */
public class PipelineRunner {

    private static final Logger log = LoggerFactory.getLogger(PipelineRunner.class);

    private final List<StageTask<?, ?>>   tasks;
    private final List<RetryTemplate>     retryTemplates;
    private final ResilientStatusReporter reporter;
    private final MeterRegistry           meterRegistry;

    public PipelineRunner(StageRegistry stageRegistry,
                          List<StageTask<?, ?>> stageTasks,
                          ResilientStatusReporter reporter,
                          MeterRegistry meterRegistry,
                          Duration retryBackoff) {
        this.tasks          = orderByRegistry(stageRegistry, stageTasks);
        this.reporter       = reporter;
        this.meterRegistry  = meterRegistry;
        this.retryTemplates = this.tasks.stream()
                .map(t -> OrchestratorConfig.retryTemplate(t.maxAttempts(), retryBackoff)
                        .retryOn(Exception.class)
                        .build())
                .toList();
    }

    /** Stage names in the order they run. */
    public List<String> stageOrder() {
        return tasks.stream().map(StageTask::stageName).toList();
    }

    /**
     * Run every stage of the pipeline. Blocks until the run completes or fails.
     *
     * @throws StageExecutionException when a stage fails (already reported)
     */
    public PipelineRun run(Long pipelineId, String runId, RunParameters parameters) {
        PipelineRun run = new PipelineRun(pipelineId, runId);
        log.info("Starting run {} of pipeline {} ({} stages, {} records)",
                runId, pipelineId, tasks.size(), parameters.recordCount());

        Object carry = parameters;
        for (int i = 0; i < tasks.size(); i++) {
            carry = runStage(tasks.get(i), retryTemplates.get(i), carry, run);
        }

        run.complete();
        reporter.report(StatusUpdate.forPipeline(pipelineId, RunStatus.COMPLETED, null, run.getRecordsProcessed()));
        log.info("Run {} of pipeline {} completed ({} records)", runId, pipelineId, run.getRecordsProcessed());
        return run;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /**
     * One stage: RUNNING → body → COMPLETED | FAILED.
     *
     * Stage inputs are chained through Object; the cast is checked when the
     * task first uses its input, which fails the stage like any other error.
     */
    @SuppressWarnings("unchecked")
    private <I, O> O runStage(StageTask<I, O> task, RetryTemplate retry, Object input, PipelineRun run) {
        String stage = task.stageName();
        Long pipelineId = run.getPipelineId();
        StageExecutionContext ctx = new StageExecutionContext(pipelineId, run.getRunId(), stage);

        run.enterStage(stage);
        MDC.put("stage", stage);
        reporter.report(StatusUpdate.forStage(pipelineId, stage, RunStatus.RUNNING));

        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "completed";
        try {
            I typedInput = (I) input;
            RetryCallback<O, Exception> body = retryCtx -> {
                if (retryCtx.getRetryCount() > 0) {
                    log.warn("Stage '{}' attempt {}/{} after error: {}", stage,
                            retryCtx.getRetryCount() + 1, task.maxAttempts(),
                            retryCtx.getLastThrowable().getMessage());
                }
                return task.execute(typedInput, ctx);
            };
            O output = retry.execute(body);

            Long records = task.recordsProcessed(output);
            run.stageCompleted(records);
            reporter.report(StatusUpdate.forStage(pipelineId, stage, RunStatus.COMPLETED)
                    .withRecordsProcessed(records));
            return output;
        } catch (Exception e) {
            outcome = "failed";
            String message = errorMessage(e);
            run.fail();
            log.error("Stage '{}' of pipeline {} failed: {}", stage, pipelineId, message, e);
            reporter.report(StatusUpdate.forStage(pipelineId, stage, RunStatus.FAILED, message));
            throw new StageExecutionException(run, message, e);
        } finally {
            sample.stop(meterRegistry.timer("datapipe.stage.duration", "stage", stage, "outcome", outcome));
            meterRegistry.counter("datapipe.stage.runs", "stage", stage, "outcome", outcome).increment();
            MDC.remove("stage");
        }
    }

    private static String errorMessage(Throwable e) {
        String message = e.getMessage();
        return (message == null || message.isBlank()) ? e.getClass().getSimpleName() : message;
    }

    private static List<StageTask<?, ?>> orderByRegistry(StageRegistry registry, List<StageTask<?, ?>> available) {
        List<StageTask<?, ?>> ordered = new ArrayList<>();
        for (StageDefinition def : registry.defaultStages()) {
            List<StageTask<?, ?>> matches = available.stream()
                    .filter(t -> StageNames.matches(def.name(), t.stageName()))
                    .toList();
            if (matches.size() != 1) {
                throw new IllegalStateException("Expected exactly one task for stage '" + def.name()
                        + "', found " + matches.size());
            }
            ordered.add(matches.get(0));
        }
        if (ordered.size() != available.size()) {
            throw new IllegalStateException("Tasks registered for unknown stages: " + available.stream()
                    .map(StageTask::stageName)
                    .filter(n -> registry.find(n).isEmpty())
                    .toList());
        }
        return List.copyOf(ordered);
    }
}
