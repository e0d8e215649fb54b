package com.datapipe.orchestrator.service;

import com.datapipe.orchestrator.model.Pipeline;
import com.datapipe.orchestrator.model.Stage;
import com.datapipe.orchestrator.registry.StageDefinition;
import com.datapipe.orchestrator.registry.StageNames;
import com.datapipe.orchestrator.registry.StageRegistry;
import com.datapipe.orchestrator.repository.OffsetPageRequest;
import com.datapipe.orchestrator.repository.PipelineRepository;
import com.datapipe.orchestrator.repository.StageRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * CRUD over pipelines and their stages.
 *
 * Getters report unknown ids as an empty Optional (or false for delete);
 * the caller decides whether absence is fatal. Status changes go through
 * StatusUpdateService, not through the update methods here.
 */
@Service
public class PipelineStore {

    private static final Logger log = LoggerFactory.getLogger(PipelineStore.class);

    private static final Sort NEWEST_FIRST =
            Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id"));

    private final PipelineRepository pipelineRepo;
    private final StageRepository    stageRepo;
    private final StageRegistry      stageRegistry;
    private final Clock              clock;

    public PipelineStore(PipelineRepository pipelineRepo,
                         StageRepository stageRepo,
                         StageRegistry stageRegistry,
                         Clock clock) {
        this.pipelineRepo  = pipelineRepo;
        this.stageRepo     = stageRepo;
        this.stageRegistry = stageRegistry;
        this.clock         = clock;
    }

    // ------------------------------------------------------------------
    // Pipelines
    // ------------------------------------------------------------------

    /**
     * Insert a PENDING pipeline plus one PENDING stage per registry entry.
     *
     * Both inserts share one transaction: a failing stage insert rolls the
     * pipeline back, so no pipeline is ever left without its stages.
     */
    @Transactional
    public Pipeline createPipeline(String name, String description) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Pipeline name is required");
        }
        Pipeline pipeline = new Pipeline(name.trim(), description);
        Instant now = clock.instant();
        pipeline.setCreatedAt(now);
        pipeline.setUpdatedAt(now);
        pipeline = pipelineRepo.save(pipeline);

        for (StageDefinition def : stageRegistry.defaultStages()) {
            Stage stage = stageRepo.save(new Stage(pipeline, def.name(), def.description()));
            pipeline.addStage(stage);
        }
        log.info("Created pipeline {} '{}' with {} stages",
                pipeline.getId(), pipeline.getName(), pipeline.getStages().size());
        return pipeline;
    }

    @Transactional(readOnly = true)
    public Optional<Pipeline> getPipeline(Long id) {
        return pipelineRepo.findById(id);
    }

    /** Newest first; skip/limit are raw offsets. */
    @Transactional(readOnly = true)
    public List<Pipeline> listPipelines(int skip, int limit) {
        if (skip < 0 || limit < 1) {
            throw new ValidationException("skip must be >= 0 and limit >= 1, got skip="
                    + skip + " limit=" + limit);
        }
        return pipelineRepo.findAllBy(new OffsetPageRequest(skip, limit, NEWEST_FIRST));
    }

    /**
     * Apply field-level changes to a pipeline. updated_at is refreshed on
     * every call, even when the changes turn out to be no-ops.
     *
     * The row is locked like in StatusUpdateService: Hibernate writes every
     * column, so an unlocked read-modify-write would undo a status change
     * committed in between.
     */
    @Transactional
    public Optional<Pipeline> updatePipeline(Long id, Consumer<Pipeline> changes) {
        return pipelineRepo.findByIdForUpdate(id).map(pipeline -> {
            changes.accept(pipeline);
            pipeline.setUpdatedAt(clock.instant());
            return pipelineRepo.save(pipeline);
        });
    }

    /** Delete a pipeline and, by cascade, its stages. */
    @Transactional
    public boolean deletePipeline(Long id) {
        Optional<Pipeline> pipeline = pipelineRepo.findById(id);
        if (pipeline.isEmpty()) {
            return false;
        }
        pipelineRepo.delete(pipeline.get());
        log.info("Deleted pipeline {}", id);
        return true;
    }

    // ------------------------------------------------------------------
    // Stages
    // ------------------------------------------------------------------

    /** Stages of a pipeline in id order; empty for an unknown pipeline. */
    @Transactional(readOnly = true)
    public List<Stage> getStages(Long pipelineId) {
        return stageRepo.findByPipelineIdOrderByIdAsc(pipelineId);
    }

    /**
     * Find a stage by name, ignoring case and accepting the identifier form
     * ("data_generation" finds "Data Generation").
     */
    @Transactional(readOnly = true)
    public Optional<Stage> findStageByName(Long pipelineId, String name) {
        return findStageByName(stageRepo.findByPipelineIdOrderByIdAsc(pipelineId), name);
    }

    /** Field-level changes to a stage; locks the pipeline row, then the stage row. */
    @Transactional
    public Optional<Stage> updateStage(Long id, Consumer<Stage> changes) {
        return stageRepo.findPipelineIdById(id)
                .flatMap(pipelineRepo::findByIdForUpdate)
                .flatMap(pipeline -> stageRepo.findByIdForUpdate(id))
                .map(stage -> {
                    changes.accept(stage);
                    return stageRepo.save(stage);
                });
    }

    static Optional<Stage> findStageByName(List<Stage> stages, String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return stages.stream()
                .filter(s -> StageNames.matches(s.getName(), name))
                .findFirst();
    }
}
