package com.datapipe.orchestrator.repository;

import com.datapipe.orchestrator.model.Pipeline;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * CRUD + query operations for the pipelines table.
 */
public interface PipelineRepository extends JpaRepository<Pipeline, Long> {

    /**
     * Load a pipeline with a row lock (SELECT ... FOR UPDATE).
     *
     * Every status update locks the pipeline row first and the stage row
     * second. Two stages finishing at the same time therefore aggregate one
     * after the other, and the second one sees the first one's COMPLETED.
     * Must run inside a @Transactional method.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Pipeline p WHERE p.id = :id")
    Optional<Pipeline> findByIdForUpdate(@Param("id") Long id);

    /** Page through pipelines; ordering comes from the Pageable's sort. */
    List<Pipeline> findAllBy(Pageable pageable);
}
