package com.datapipe.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * One named unit of work within a Pipeline.
 *
 * Timing fields are written by StatusUpdateService only:
 *   started_at             : first transition into RUNNING
 *   completed_at           : first transition into COMPLETED
 *   execution_time_seconds : completed_at - started_at, when started_at is known
 *
 * DB table: pipeline_stages  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "pipeline_stages")
public class Stage {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // Fixed at construction; a stage never moves between pipelines.
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "pipeline_id", nullable = false, updatable = false)
    private Pipeline pipeline;

    @Column(nullable = false)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RunStatus status = RunStatus.PENDING;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "execution_time_seconds")
    private Double executionTimeSeconds;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Stage() {}   // required by JPA

    public Stage(Pipeline pipeline, String name, String description) {
        this.pipeline    = pipeline;
        this.name        = name;
        this.description = description;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public Long      getId()                   { return id; }
    public Pipeline  getPipeline()             { return pipeline; }
    public String    getName()                 { return name; }
    public String    getDescription()          { return description; }
    public RunStatus getStatus()               { return status; }
    public Instant   getStartedAt()            { return startedAt; }
    public Instant   getCompletedAt()          { return completedAt; }
    public Double    getExecutionTimeSeconds() { return executionTimeSeconds; }
    public String    getErrorMessage()         { return errorMessage; }

    public Long getPipelineId() {
        return pipeline.getId();
    }

    public void setStatus(RunStatus status)              { this.status = status; }
    public void setDescription(String description)       { this.description = description; }
    public void setStartedAt(Instant t)                  { this.startedAt = t; }
    public void setCompletedAt(Instant t)                { this.completedAt = t; }
    public void setExecutionTimeSeconds(Double seconds)  { this.executionTimeSeconds = seconds; }
    public void setErrorMessage(String errorMessage)     { this.errorMessage = errorMessage; }

    @Override
    public String toString() {
        return "Stage " + id + ": " + name + " (" + status.value() + ")";
    }
}
