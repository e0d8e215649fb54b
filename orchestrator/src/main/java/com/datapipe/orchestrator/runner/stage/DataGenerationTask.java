package com.datapipe.orchestrator.runner.stage;

import com.datapipe.orchestrator.config.OrchestratorProperties;
import com.datapipe.orchestrator.dataset.DatasetFiles;
import com.datapipe.orchestrator.dataset.Item;
import com.datapipe.orchestrator.registry.StageRegistry;
import com.datapipe.orchestrator.runner.RunParameters;
import com.datapipe.orchestrator.runner.StageExecutionContext;
import com.datapipe.orchestrator.runner.StageTask;
import com.datapipe.orchestrator.service.PipelineStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Stage 1: write a sample dataset to the input directory and record the
 * file on the pipeline.
 *
 * Values are random (category A-D, value 10-1000, quantity 1-100, created
 * within the last 30 days); a configured seed makes them repeatable.
 */
@Component
public class DataGenerationTask implements StageTask<RunParameters, GeneratedDataset> {

    private static final Logger log = LoggerFactory.getLogger(DataGenerationTask.class);

    private static final String[] CATEGORIES = {"A", "B", "C", "D"};
    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final DatasetFiles           files;
    private final PipelineStore          store;
    private final OrchestratorProperties props;
    private final Clock                  clock;

    public DataGenerationTask(DatasetFiles files, PipelineStore store,
                              OrchestratorProperties props, Clock clock) {
        this.files = files;
        this.store = store;
        this.props = props;
        this.clock = clock;
    }

    @Override
    public String stageName() {
        return StageRegistry.DATA_GENERATION;
    }

    @Override
    public int maxAttempts() {
        return props.stageRetry().generationAttempts();
    }

    @Override
    public GeneratedDataset execute(RunParameters input, StageExecutionContext ctx) throws Exception {
        int count = input.recordCount();
        log.info("Generating {} records of sample data", count);

        LocalDateTime now = LocalDateTime.now(clock);
        Random random = props.randomSeed() != null ? new Random(props.randomSeed()) : new Random();

        List<Item> items = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            items.add(Item.generated(
                    i,
                    CATEGORIES[random.nextInt(CATEGORIES.length)],
                    BigDecimal.valueOf(10 + random.nextDouble() * 990).setScale(2, RoundingMode.HALF_UP).doubleValue(),
                    1 + random.nextInt(100),
                    random.nextBoolean(),
                    now.minusDays(random.nextInt(31)).toString()));
        }

        Path file = props.inputDir().resolve(
                "pipeline_" + ctx.pipelineId() + "_sample_data_" + now.format(FILE_TIMESTAMP) + ".json");
        files.writeItems(file, items);
        store.updatePipeline(ctx.pipelineId(), p -> p.setInputFile(file.toString()));
        log.info("Generated data file: {}", file);

        SimulatedWork.pause(props.simulatedDelay());
        return new GeneratedDataset(file, items.size());
    }

    @Override
    public Long recordsProcessed(GeneratedDataset output) {
        return (long) output.recordCount();
    }
}
