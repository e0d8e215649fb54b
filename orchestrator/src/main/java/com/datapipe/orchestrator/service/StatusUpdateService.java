package com.datapipe.orchestrator.service;

import com.datapipe.orchestrator.model.Pipeline;
import com.datapipe.orchestrator.model.RunStatus;
import com.datapipe.orchestrator.model.Stage;
import com.datapipe.orchestrator.repository.PipelineRepository;
import com.datapipe.orchestrator.repository.StageRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * The only mutation path for stage and pipeline status.
 *
 * Updates may arrive more than once and out of order (they come back from
 * the runner over an at-least-once channel), so:
 *   - started_at is written on the first RUNNING only
 *   - completed_at / execution_time_seconds on the first COMPLETED only
 *   - a pipeline becomes COMPLETED only when every stage is COMPLETED
 *   - a pipeline becomes FAILED as soon as any stage reports FAILED
 *   - COMPLETED and FAILED are final for the pipeline; a FAILED pipeline
 *     keeps the error message of the first failure
 *
 * Locking order is pipeline row, then stage row (see PipelineRepository).
 */
@Service
public class StatusUpdateService {

    private static final Logger log = LoggerFactory.getLogger(StatusUpdateService.class);

    private final PipelineRepository pipelineRepo;
    private final StageRepository    stageRepo;
    private final Clock              clock;

    public StatusUpdateService(PipelineRepository pipelineRepo,
                               StageRepository stageRepo,
                               Clock clock) {
        this.pipelineRepo = pipelineRepo;
        this.stageRepo    = stageRepo;
        this.clock        = clock;
    }

    @Transactional
    public StatusUpdateResult apply(StatusUpdate update) {
        Optional<Pipeline> found = pipelineRepo.findByIdForUpdate(update.pipelineId());
        if (found.isEmpty()) {
            log.warn("Status update for unknown pipeline {}", update.pipelineId());
            return StatusUpdateResult.PIPELINE_NOT_FOUND;
        }
        Pipeline pipeline = found.get();
        Instant  now      = clock.instant();

        if (!update.isStageUpdate()) {
            applyToPipeline(pipeline, update, now);
            return StatusUpdateResult.UPDATED;
        }

        Optional<Stage> stage = lockStage(pipeline.getId(), update.stageName());
        if (stage.isEmpty()) {
            log.warn("Status update for unknown stage '{}' of pipeline {}",
                    update.stageName(), pipeline.getId());
            return StatusUpdateResult.STAGE_NOT_FOUND;
        }
        applyToStage(stage.get(), update, now);

        switch (update.status()) {
            case COMPLETED -> completeIfAllStagesDone(pipeline, now);
            case FAILED    -> transitionPipeline(pipeline, RunStatus.FAILED, update.errorMessage(), now);
            default        -> { }
        }
        return StatusUpdateResult.UPDATED;
    }

    /**
     * Reserve a PENDING pipeline for one run and mark it RUNNING.
     *
     * The run id and the RUNNING status commit together under the pipeline
     * row lock, so a pipeline is never left claimed but not running, and a
     * concurrent trigger of the same pipeline finds the run id and is rejected.
     *
     * @return empty if the pipeline does not exist
     * @throws PipelineStateException if the pipeline is not PENDING or already claimed
     */
    @Transactional
    public Optional<Pipeline> startRun(Long pipelineId, String runId) {
        return pipelineRepo.findByIdForUpdate(pipelineId).map(pipeline -> {
            if (pipeline.getStatus() != RunStatus.PENDING || pipeline.getExternalRunId() != null) {
                throw new PipelineStateException(pipelineId, pipeline.getStatus(),
                        "Pipeline " + pipelineId + " cannot be triggered: status is "
                        + pipeline.getStatus().value()
                        + (pipeline.getExternalRunId() != null ? ", run " + pipeline.getExternalRunId() : ""));
            }
            pipeline.setExternalRunId(runId);
            transitionPipeline(pipeline, RunStatus.RUNNING, null, clock.instant());
            return pipeline;
        });
    }

    // ------------------------------------------------------------------
    // Stage transition
    // ------------------------------------------------------------------

    private void applyToStage(Stage stage, StatusUpdate update, Instant now) {
        RunStatus previous = stage.getStatus();
        stage.setStatus(update.status());

        if (update.status() == RunStatus.RUNNING && stage.getStartedAt() == null) {
            stage.setStartedAt(now);
        }
        if (update.status() == RunStatus.COMPLETED && stage.getCompletedAt() == null) {
            stage.setCompletedAt(now);
            if (stage.getStartedAt() != null) {
                stage.setExecutionTimeSeconds(secondsBetween(stage.getStartedAt(), now));
            }
        }
        if (update.errorMessage() != null) {
            stage.setErrorMessage(update.errorMessage());
        }
        stageRepo.save(stage);

        log.info("Pipeline {} stage '{}': {} → {}",
                stage.getPipelineId(), stage.getName(), previous.value(), update.status().value());
    }

    private Optional<Stage> lockStage(Long pipelineId, String stageName) {
        List<Stage> stages = stageRepo.findByPipelineIdOrderByIdAsc(pipelineId);
        return PipelineStore.findStageByName(stages, stageName)
                .flatMap(s -> stageRepo.findByIdForUpdate(s.getId()));
    }

    // ------------------------------------------------------------------
    // Pipeline derivation
    // ------------------------------------------------------------------

    private void completeIfAllStagesDone(Pipeline pipeline, Instant now) {
        List<Stage> stages = stageRepo.findByPipelineIdOrderByIdAsc(pipeline.getId());
        boolean allCompleted = !stages.isEmpty()
                && stages.stream().allMatch(s -> s.getStatus() == RunStatus.COMPLETED);
        if (allCompleted) {
            transitionPipeline(pipeline, RunStatus.COMPLETED, null, now);
        }
    }

    private void applyToPipeline(Pipeline pipeline, StatusUpdate update, Instant now) {
        boolean accepted = transitionPipeline(pipeline, update.status(), update.errorMessage(), now);
        if (accepted && update.recordsProcessed() != null) {
            pipeline.setRecordsProcessed(update.recordsProcessed());
            pipelineRepo.save(pipeline);
        }
    }

    /**
     * Move the pipeline to {@code target}, unless it already reached a
     * different terminal status.
     *
     * @return false when the transition was rejected
     */
    private boolean transitionPipeline(Pipeline pipeline, RunStatus target, String errorMessage, Instant now) {
        RunStatus current = pipeline.getStatus();
        // Terminal statuses are final: a stage FAILED arriving after the
        // pipeline COMPLETED does not reopen it, and a second failure does
        // not replace the first error.
        if (current.isTerminal() && current != target) {
            log.warn("Pipeline {} is already {}, ignoring transition to {}",
                    pipeline.getId(), current.value(), target.value());
            return false;
        }

        if (current == RunStatus.FAILED) {
            // Repeated failure report: the first error message stays.
            if (pipeline.getErrorMessage() == null && errorMessage != null) {
                pipeline.setErrorMessage(errorMessage);
            }
        } else {
            pipeline.setStatus(target);
            if (errorMessage != null) {
                pipeline.setErrorMessage(errorMessage);
            }
        }
        pipeline.setUpdatedAt(now);
        pipelineRepo.save(pipeline);

        if (current != target) {
            if (target == RunStatus.FAILED) {
                log.error("Pipeline {} FAILED: {}", pipeline.getId(), errorMessage);
            } else {
                log.info("Pipeline {}: {} → {}", pipeline.getId(), current.value(), target.value());
            }
        }
        return true;
    }

    private static double secondsBetween(Instant start, Instant end) {
        return Duration.between(start, end).toMillis() / 1000.0;
    }
}
