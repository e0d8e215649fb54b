package com.datapipe.orchestrator.runner.stage;

import com.datapipe.orchestrator.config.OrchestratorProperties;
import com.datapipe.orchestrator.dataset.Item;
import com.datapipe.orchestrator.registry.StageRegistry;
import com.datapipe.orchestrator.runner.StageExecutionContext;
import com.datapipe.orchestrator.runner.StageTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Stage 3: compute {@code total_value = value * quantity} for every record,
 * in parallel batches.
 */
@Component
public class SparkProcessingTask implements StageTask<List<Item>, List<Item>> {

    private static final Logger log = LoggerFactory.getLogger(SparkProcessingTask.class);

    static final String PROCESSED_BY = "spark";

    private final BatchProcessor         batches;
    private final OrchestratorProperties props;
    private final Clock                  clock;

    public SparkProcessingTask(@Qualifier("batchExecutor") TaskExecutor batchExecutor,
                               OrchestratorProperties props, Clock clock) {
        this.batches = new BatchProcessor(batchExecutor, props.batchSize());
        this.props   = props;
        this.clock   = clock;
    }

    @Override
    public String stageName() {
        return StageRegistry.SPARK_PROCESSING;
    }

    @Override
    public List<Item> execute(List<Item> input, StageExecutionContext ctx) throws Exception {
        log.info("Processing {} records in batches of {}", input.size(), props.batchSize());
        String processedAt = LocalDateTime.now(clock).toString();

        List<Item> processed = batches.process(input, chunk -> chunk.stream()
                .map(item -> item.withProcessing(item.value() * item.quantity(), PROCESSED_BY, processedAt))
                .toList());

        SimulatedWork.pause(props.simulatedDelay());
        log.info("Processed {} records", processed.size());
        return processed;
    }

    @Override
    public Long recordsProcessed(List<Item> output) {
        return (long) output.size();
    }
}
