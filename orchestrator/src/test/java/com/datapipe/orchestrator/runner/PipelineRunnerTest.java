package com.datapipe.orchestrator.runner;

import com.datapipe.orchestrator.config.OrchestratorConfig;
import com.datapipe.orchestrator.model.RunStatus;
import com.datapipe.orchestrator.registry.StageRegistry;
import com.datapipe.orchestrator.reporter.ResilientStatusReporter;
import com.datapipe.orchestrator.reporter.StatusReporter;
import com.datapipe.orchestrator.reporter.TransportException;
import com.datapipe.orchestrator.service.StatusUpdate;
import com.datapipe.orchestrator.service.StatusUpdateResult;
import com.datapipe.orchestrator.support.StubStageTask;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.datapipe.orchestrator.registry.StageRegistry.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Sequencing, reporting and retry behaviour of PipelineRunner.
 *
 * Status updates are captured by a recording reporter instead of a store,
 * so each test sees exactly what the runner emitted and in which order.
 */
class PipelineRunnerTest {

    SimpleMeterRegistry meters;
    List<StatusUpdate>  reported;
    StatusReporter      recording;

    @BeforeEach
    void setUp() {
        meters    = new SimpleMeterRegistry();
        reported  = new ArrayList<>();
        recording = update -> {
            reported.add(update);
            return StatusUpdateResult.UPDATED;
        };
    }

    // ------------------------------------------------------------------
    // Ordering and reporting
    // ------------------------------------------------------------------

    @Test
    void run_tasksRegisteredOutOfOrder_executeInRegistryOrder() {
        List<StubStageTask> tasks = List.of(
                StubStageTask.succeeding(DATA_EXPORT, 5),
                StubStageTask.succeeding(SPARK_PROCESSING, 3),
                StubStageTask.succeeding(DATA_GENERATION, 1),
                StubStageTask.succeeding(DBT_TRANSFORMATION, 4),
                StubStageTask.succeeding(DATA_INGESTION, 2));

        PipelineRunner runner = runner(tasks, recording);

        assertThat(runner.stageOrder()).containsExactly(
                DATA_GENERATION, DATA_INGESTION, SPARK_PROCESSING, DBT_TRANSFORMATION, DATA_EXPORT);
    }

    @Test
    void run_success_reportsRunningThenCompletedPerStageThenPipelineCompleted() {
        PipelineRun run = runner(allSucceeding(1000), recording).run(1L, "run-1", new RunParameters(1000));

        assertThat(run.getPhase()).isEqualTo(RunPhase.COMPLETED);
        assertThat(run.getRecordsProcessed()).isEqualTo(1000);
        assertThat(reported).hasSize(11);
        for (int i = 0; i < 5; i++) {
            StatusUpdate running   = reported.get(2 * i);
            StatusUpdate completed = reported.get(2 * i + 1);
            assertThat(running.status()).isEqualTo(RunStatus.RUNNING);
            assertThat(completed.status()).isEqualTo(RunStatus.COMPLETED);
            assertThat(completed.stageName()).isEqualTo(running.stageName());
            assertThat(completed.recordsProcessed()).isEqualTo(1000);
        }
        StatusUpdate last = reported.get(10);
        assertThat(last.isStageUpdate()).isFalse();
        assertThat(last.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(last.recordsProcessed()).isEqualTo(1000);
    }

    @Test
    void run_chainsEachOutputIntoNextInput() {
        List<StubStageTask> tasks = List.of(
                StubStageTask.succeeding(DATA_GENERATION, 10),
                StubStageTask.succeeding(DATA_INGESTION, 20),
                StubStageTask.succeeding(SPARK_PROCESSING, 30),
                StubStageTask.succeeding(DBT_TRANSFORMATION, 40),
                StubStageTask.succeeding(DATA_EXPORT, 50));
        RunParameters params = new RunParameters(10);

        runner(tasks, recording).run(1L, "run-1", params);

        assertThat(tasks.get(0).inputs()).containsExactly(params);
        assertThat(tasks.get(1).inputs()).containsExactly(10L);
        assertThat(tasks.get(4).inputs()).containsExactly(40L);
    }

    @Test
    void run_stageFails_haltsAndReportsFailureWithMessage() {
        StubStageTask processing = StubStageTask.succeeding(SPARK_PROCESSING, 1);
        List<StubStageTask> tasks = List.of(
                StubStageTask.succeeding(DATA_GENERATION, 1),
                StubStageTask.failing(DATA_INGESTION, "file not found"),
                processing,
                StubStageTask.succeeding(DBT_TRANSFORMATION, 1),
                StubStageTask.succeeding(DATA_EXPORT, 1));

        assertThatThrownBy(() -> runner(tasks, recording).run(1L, "run-1", new RunParameters(1)))
                .isInstanceOf(StageExecutionException.class)
                .satisfies(e -> {
                    StageExecutionException see = (StageExecutionException) e;
                    assertThat(see.getStageName()).isEqualTo(DATA_INGESTION);
                    assertThat(see.getRun().getPhase()).isEqualTo(RunPhase.FAILED);
                    assertThat(see.getRun().getCompletedStages()).containsExactly(DATA_GENERATION);
                    assertThat(see.getCause()).hasMessage("file not found");
                });

        assertThat(processing.invocations()).isZero();
        assertThat(reported).extracting(StatusUpdate::status).containsExactly(
                RunStatus.RUNNING, RunStatus.COMPLETED, RunStatus.RUNNING, RunStatus.FAILED);
        assertThat(reported.get(3).errorMessage()).isEqualTo("file not found");
        assertThat(meters.counter("datapipe.stage.runs", "stage", DATA_INGESTION, "outcome", "failed").count())
                .isEqualTo(1.0);
    }

    // ------------------------------------------------------------------
    // Retry
    // ------------------------------------------------------------------

    @Test
    void run_flakyStageWithinAttempts_succeedsWithOneRunningReport() {
        StubStageTask flaky = StubStageTask.flaky(DATA_GENERATION, 7, 2, 3);
        List<StubStageTask> tasks = new ArrayList<>(allSucceeding(7));
        tasks.set(0, flaky);

        runner(tasks, recording).run(1L, "run-1", new RunParameters(7));

        assertThat(flaky.invocations()).isEqualTo(3);
        assertThat(reported.stream().filter(u -> DATA_GENERATION.equals(u.stageName())))
                .extracting(StatusUpdate::status)
                .containsExactly(RunStatus.RUNNING, RunStatus.COMPLETED);
    }

    @Test
    void run_flakyStageExhaustsAttempts_fails() {
        StubStageTask flaky = StubStageTask.flaky(DATA_GENERATION, 7, 5, 2);
        List<StubStageTask> tasks = new ArrayList<>(allSucceeding(7));
        tasks.set(0, flaky);

        assertThatThrownBy(() -> runner(tasks, recording).run(1L, "run-1", new RunParameters(7)))
                .isInstanceOf(StageExecutionException.class);
        assertThat(flaky.invocations()).isEqualTo(2);
    }

    // ------------------------------------------------------------------
    // Status delivery failures
    // ------------------------------------------------------------------

    @Test
    void run_reporterAlwaysFails_stagesStillComplete() {
        StatusReporter broken = update -> {
            throw new TransportException("connection refused");
        };

        PipelineRun run = runner(allSucceeding(3), broken).run(1L, "run-1", new RunParameters(3));

        assertThat(run.getPhase()).isEqualTo(RunPhase.COMPLETED);
        assertThat(run.getCompletedStages()).hasSize(5);
        assertThat(meters.counter("datapipe.status.report.failures", "status", "running").count())
                .isEqualTo(5.0);
    }

    // ------------------------------------------------------------------
    // Wiring checks
    // ------------------------------------------------------------------

    @Test
    void constructor_missingTask_rejected() {
        List<StubStageTask> tasks = new ArrayList<>(allSucceeding(1));
        tasks.remove(2);

        assertThatThrownBy(() -> runner(tasks, recording))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining(SPARK_PROCESSING);
    }

    @Test
    void constructor_taskForUnknownStage_rejected() {
        List<StubStageTask> tasks = new ArrayList<>(allSucceeding(1));
        tasks.add(StubStageTask.succeeding("Data Archival", 1));

        assertThatThrownBy(() -> runner(tasks, recording))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Data Archival");
    }

    private static List<StubStageTask> allSucceeding(long records) {
        return StageRegistry.defaultRegistry().defaultStages().stream()
                .map(d -> StubStageTask.succeeding(d.name(), records))
                .toList();
    }

    private PipelineRunner runner(List<StubStageTask> tasks, StatusReporter delegate) {
        ResilientStatusReporter reporter = new ResilientStatusReporter(delegate,
                OrchestratorConfig.retryTemplate(2, Duration.ZERO).retryOn(TransportException.class).build(),
                meters);
        return new PipelineRunner(StageRegistry.defaultRegistry(), List.copyOf(tasks), reporter,
                meters, Duration.ZERO);
    }
}
