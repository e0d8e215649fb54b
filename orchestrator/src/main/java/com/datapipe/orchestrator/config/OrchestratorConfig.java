package com.datapipe.orchestrator.config;

import com.datapipe.orchestrator.registry.StageRegistry;
import com.datapipe.orchestrator.reporter.HttpStatusReporter;
import com.datapipe.orchestrator.reporter.ResilientStatusReporter;
import com.datapipe.orchestrator.reporter.StatusReporter;
import com.datapipe.orchestrator.reporter.StoreStatusReporter;
import com.datapipe.orchestrator.reporter.TransportException;
import com.datapipe.orchestrator.runner.PipelineRunner;
import com.datapipe.orchestrator.runner.StageTask;
import com.datapipe.orchestrator.service.StatusUpdateService;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.retry.support.RetryTemplateBuilder;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Wiring for the runner side of the orchestrator: thread pools, the stage
 * registry, status delivery and the runner itself.
 */
@Configuration
@EnableConfigurationProperties(OrchestratorProperties.class)
public class OrchestratorConfig {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public StageRegistry stageRegistry() {
        return StageRegistry.defaultRegistry();
    }

    /**
     * Runs whole pipelines, one task per run. Bounded so a burst of
     * triggers queues up instead of starting unbounded threads.
     */
    @Bean
    public ThreadPoolTaskExecutor pipelineRunExecutor(OrchestratorProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.workerThreads());
        executor.setMaxPoolSize(props.workerThreads());
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("pipeline-run-");
        executor.initialize();
        return executor;
    }

    /** Workers for the scatter/gather inside the processing stage. */
    @Bean
    public ThreadPoolTaskExecutor batchExecutor(OrchestratorProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.workerThreads());
        executor.setMaxPoolSize(props.workerThreads());
        executor.setThreadNamePrefix("batch-");
        executor.initialize();
        return executor;
    }

    @Bean
    public StatusReporter statusReporter(OrchestratorProperties props,
                                         StatusUpdateService statusUpdateService,
                                         ObjectMapper objectMapper) {
        OrchestratorProperties.StatusReporter cfg = props.statusReporter();
        return switch (cfg.mode()) {
            case DIRECT -> new StoreStatusReporter(statusUpdateService);
            case HTTP -> {
                if (cfg.callbackUrl() == null) {
                    throw new IllegalStateException(
                            "datapipe.status-reporter.callback-url is required when mode=http");
                }
                log.info("Status updates will be posted to {}", cfg.callbackUrl());
                yield new HttpStatusReporter(cfg.callbackUrl(), objectMapper, cfg.timeout());
            }
        };
    }

    @Bean
    public ResilientStatusReporter resilientStatusReporter(StatusReporter statusReporter,
                                                           OrchestratorProperties props,
                                                           MeterRegistry meterRegistry) {
        OrchestratorProperties.StatusReporter cfg = props.statusReporter();
        RetryTemplate retry = retryTemplate(cfg.maxAttempts(), cfg.backoff())
                .retryOn(TransportException.class)
                .build();
        return new ResilientStatusReporter(statusReporter, retry, meterRegistry);
    }

    @Bean
    public PipelineRunner pipelineRunner(StageRegistry stageRegistry,
                                         List<StageTask<?, ?>> stageTasks,
                                         ResilientStatusReporter resilientStatusReporter,
                                         MeterRegistry meterRegistry,
                                         OrchestratorProperties props) {
        return new PipelineRunner(stageRegistry, stageTasks, resilientStatusReporter,
                meterRegistry, props.stageRetry().backoff());
    }

    /** Builder with attempts and a fixed backoff; zero backoff means none. */
    public static RetryTemplateBuilder retryTemplate(int maxAttempts, Duration backoff) {
        RetryTemplateBuilder builder = RetryTemplate.builder().maxAttempts(Math.max(1, maxAttempts));
        return backoff == null || backoff.isZero() || backoff.isNegative()
                ? builder.noBackoff()
                : builder.fixedBackoff(Math.max(1, backoff.toMillis()));
    }
}
