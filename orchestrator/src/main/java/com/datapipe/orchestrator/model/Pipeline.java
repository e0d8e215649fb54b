package com.datapipe.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One tracked run through the fixed stage sequence.
 *
 * A Pipeline owns its Stages: deleting the pipeline deletes them
 * (JPA cascade plus ON DELETE CASCADE on the foreign key).
 *
 * DB table: pipelines  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "pipelines")
public class Pipeline {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RunStatus status = RunStatus.PENDING;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    // Dataset written by the generation stage.
    @Column(name = "input_file")
    private String inputFile;

    // Dataset written by the export stage.
    @Column(name = "output_file")
    private String outputFile;

    // Correlates the pipeline with the run that executes it.
    @Column(name = "external_run_id")
    private String externalRunId;

    // Set, never summed. Whole-pipeline updates that omit it leave it alone.
    @Column(name = "records_processed", nullable = false)
    private long recordsProcessed = 0;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @OneToMany(mappedBy = "pipeline", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    @OrderBy("id ASC")
    private List<Stage> stages = new ArrayList<>();

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Pipeline() {}   // required by JPA

    public Pipeline(String name, String description) {
        this.name        = name;
        this.description = description;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public Long        getId()               { return id; }
    public String      getName()             { return name; }
    public String      getDescription()      { return description; }
    public RunStatus   getStatus()           { return status; }
    public Instant     getCreatedAt()        { return createdAt; }
    public Instant     getUpdatedAt()        { return updatedAt; }
    public String      getInputFile()        { return inputFile; }
    public String      getOutputFile()       { return outputFile; }
    public String      getExternalRunId()    { return externalRunId; }
    public long        getRecordsProcessed() { return recordsProcessed; }
    public String      getErrorMessage()     { return errorMessage; }
    public List<Stage> getStages()           { return stages; }

    public void setName(String name)                  { this.name = name; }
    public void setDescription(String description)    { this.description = description; }
    public void setStatus(RunStatus status)           { this.status = status; }
    public void setInputFile(String inputFile)        { this.inputFile = inputFile; }
    public void setOutputFile(String outputFile)      { this.outputFile = outputFile; }
    public void setExternalRunId(String runId)        { this.externalRunId = runId; }
    public void setErrorMessage(String errorMessage)  { this.errorMessage = errorMessage; }
    public void setCreatedAt(Instant t)               { this.createdAt = t; }
    public void setUpdatedAt(Instant t)               { this.updatedAt = t; }

    public void setRecordsProcessed(long recordsProcessed) {
        if (recordsProcessed < 0) {
            throw new IllegalArgumentException("records_processed must not be negative: " + recordsProcessed);
        }
        this.recordsProcessed = recordsProcessed;
    }

    public void addStage(Stage stage) {
        stages.add(stage);
    }

    @Override
    public String toString() {
        return "Pipeline " + id + ": " + name + " (" + status.value() + ")";
    }
}
