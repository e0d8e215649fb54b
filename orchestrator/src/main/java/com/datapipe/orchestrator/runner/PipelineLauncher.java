package com.datapipe.orchestrator.runner;

import com.datapipe.orchestrator.config.OrchestratorProperties;
import com.datapipe.orchestrator.model.Pipeline;
import com.datapipe.orchestrator.model.RunStatus;
import com.datapipe.orchestrator.reporter.ResilientStatusReporter;
import com.datapipe.orchestrator.service.PipelineStore;
import com.datapipe.orchestrator.service.StatusUpdate;
import com.datapipe.orchestrator.service.StatusUpdateService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import java.util.UUID;

/**
 * Triggers pipeline runs.
 *
 * A trigger claims the pipeline and marks it RUNNING in one transaction
 * (PENDING only, one run per pipeline), then hands the run to the
 * pipelineRunExecutor pool. The caller gets a receipt right away.
 */
@Service
public class PipelineLauncher {

    private static final Logger log = LoggerFactory.getLogger(PipelineLauncher.class);

    private static final DateTimeFormatter RUN_NAME_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final PipelineStore           store;
    private final StatusUpdateService     statusUpdateService;
    private final ResilientStatusReporter reporter;
    private final PipelineRunner          runner;
    private final TaskExecutor            executor;
    private final OrchestratorProperties  props;
    private final Clock                   clock;

    public PipelineLauncher(PipelineStore store,
                            StatusUpdateService statusUpdateService,
                            ResilientStatusReporter reporter,
                            PipelineRunner runner,
                            @Qualifier("pipelineRunExecutor") TaskExecutor executor,
                            OrchestratorProperties props,
                            Clock clock) {
        this.store               = store;
        this.statusUpdateService = statusUpdateService;
        this.reporter            = reporter;
        this.runner              = runner;
        this.executor            = executor;
        this.props               = props;
        this.clock               = clock;
    }

    /**
     * Trigger the run of an existing pipeline.
     *
     * @return empty if the pipeline does not exist
     * @throws com.datapipe.orchestrator.service.PipelineStateException if it is not PENDING
     */
    public Optional<TriggerReceipt> trigger(Long pipelineId) {
        String runId = UUID.randomUUID().toString();
        Optional<Pipeline> claimed = statusUpdateService.startRun(pipelineId, runId);
        if (claimed.isEmpty()) {
            return Optional.empty();
        }

        RunParameters parameters = new RunParameters(props.recordCount());
        try {
            executor.execute(() -> execute(pipelineId, runId, parameters));
        } catch (TaskRejectedException e) {
            log.error("Could not schedule run {} of pipeline {}: {}", runId, pipelineId, e.getMessage());
            statusUpdateService.apply(StatusUpdate.forPipeline(pipelineId, RunStatus.FAILED,
                    "Run could not be scheduled: " + e.getMessage(), null));
            throw e;
        }
        log.info("Triggered run {} of pipeline {}", runId, pipelineId);
        return Optional.of(new TriggerReceipt(pipelineId, runId));
    }

    /** Create a pipeline named after the current time and trigger it. */
    public TriggerReceipt createAndTrigger() {
        String name = "Pipeline Run " + LocalDateTime.now(clock).format(RUN_NAME_FORMAT);
        Pipeline pipeline = store.createPipeline(name, null);
        return trigger(pipeline.getId())
                .orElseThrow(() -> new IllegalStateException("Pipeline " + pipeline.getId() + " vanished"));
    }

    /**
     * Body of the background task.
     *
     * A stage failure has already been reported by the runner; here it only
     * marks the end of the run. Anything else escaped the runner and is
     * reported as a pipeline failure.
     */
    void execute(Long pipelineId, String runId, RunParameters parameters) {
        MDC.put("pipelineId", String.valueOf(pipelineId));
        MDC.put("runId",      runId);
        try {
            runner.run(pipelineId, runId, parameters);
        } catch (StageExecutionException e) {
            log.error("Run {} of pipeline {} terminated at stage '{}'",
                    runId, pipelineId, e.getStageName());
        } catch (RuntimeException e) {
            log.error("Unhandled error in run {} of pipeline {}: {}", runId, pipelineId, e.getMessage(), e);
            reporter.report(StatusUpdate.forPipeline(pipelineId, RunStatus.FAILED,
                    "Unhandled error: " + e.getMessage(), null));
        } finally {
            // Pool threads are reused; don't leak this run's context.
            MDC.clear();
        }
    }
}
