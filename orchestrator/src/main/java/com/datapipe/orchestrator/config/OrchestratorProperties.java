package com.datapipe.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;

/**
 * All orchestrator settings, bound from the {@code datapipe.*} keys in
 * application.yml and handed to the beans that need them.
 *
 * <pre>
 * datapipe:
 *   input-dir: /app/data/input
 *   output-dir: /app/data/output
 *   record-count: 1000
 *   batch-size: 200
 *   worker-threads: 4
 *   simulated-delay: 1s
 *   stage-retry:
 *     generation-attempts: 3
 *     ingestion-attempts: 4
 *     backoff: 500ms
 *   status-reporter:
 *     mode: direct            # or http
 *     callback-url: http://localhost:8080/api/status-update
 *     max-attempts: 3
 *     backoff: 200ms
 * </pre>
 *
 * @param inputDir       where the generation stage writes its dataset
 * @param outputDir      where the export stage writes its results
 * @param recordCount    records generated per run
 * @param batchSize      chunk size for the processing stage's scatter/gather
 * @param workerThreads  pipeline runs executing at the same time
 * @param simulatedDelay sleep inside each simulated stage body (zero in tests)
 * @param randomSeed     fixed seed for generated data; null = random
 */
@ConfigurationProperties(prefix = "datapipe")
public record OrchestratorProperties(
        @DefaultValue("data/input")  Path     inputDir,
        @DefaultValue("data/output") Path     outputDir,
        @DefaultValue("1000")        int      recordCount,
        @DefaultValue("200")         int      batchSize,
        @DefaultValue("4")           int      workerThreads,
        @DefaultValue("0s")          Duration simulatedDelay,
                                     Long     randomSeed,
        @DefaultValue StageRetry     stageRetry,
        @DefaultValue StatusReporter statusReporter
) {

    /**
     * Per-stage retry policy. Generation and ingestion deal with files and
     * get extra attempts; the other stages run once.
     */
    public record StageRetry(
            @DefaultValue("3")     int      generationAttempts,
            @DefaultValue("4")     int      ingestionAttempts,
            @DefaultValue("500ms") Duration backoff) {}

    /**
     * How stage status reaches the store.
     *
     * @param mode        DIRECT calls the status update protocol in-process,
     *                    HTTP posts to callbackUrl
     * @param maxAttempts delivery attempts before an update is dropped and logged
     */
    public record StatusReporter(
            @DefaultValue("direct") Mode     mode,
                                    URI      callbackUrl,
            @DefaultValue("3")      int      maxAttempts,
            @DefaultValue("200ms")  Duration backoff,
            @DefaultValue("10s")    Duration timeout) {

        public enum Mode { DIRECT, HTTP }
    }
}
