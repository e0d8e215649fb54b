package com.datapipe.orchestrator.repository;

import com.datapipe.orchestrator.model.Stage;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * CRUD + status-update queries for the pipeline_stages table.
 */
public interface StageRepository extends JpaRepository<Stage, Long> {

    /** All stages of a pipeline, in creation (= execution) order. */
    @Query("SELECT s FROM Stage s WHERE s.pipeline.id = :pipelineId ORDER BY s.id ASC")
    List<Stage> findByPipelineIdOrderByIdAsc(@Param("pipelineId") Long pipelineId);

    /** Owning pipeline of a stage, read without loading or locking the stage. */
    @Query("SELECT s.pipeline.id FROM Stage s WHERE s.id = :id")
    Optional<Long> findPipelineIdById(@Param("id") Long id);

    /** Row-locked load used by the status update protocol. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM Stage s WHERE s.id = :id")
    Optional<Stage> findByIdForUpdate(@Param("id") Long id);
}
