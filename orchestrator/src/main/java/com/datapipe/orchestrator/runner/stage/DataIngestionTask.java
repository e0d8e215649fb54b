package com.datapipe.orchestrator.runner.stage;

import com.datapipe.orchestrator.config.OrchestratorProperties;
import com.datapipe.orchestrator.dataset.DatasetFiles;
import com.datapipe.orchestrator.dataset.Item;
import com.datapipe.orchestrator.registry.StageRegistry;
import com.datapipe.orchestrator.runner.StageExecutionContext;
import com.datapipe.orchestrator.runner.StageTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Stage 2: read the generated dataset back into memory.
 */
@Component
public class DataIngestionTask implements StageTask<GeneratedDataset, List<Item>> {

    private static final Logger log = LoggerFactory.getLogger(DataIngestionTask.class);

    private final DatasetFiles           files;
    private final OrchestratorProperties props;

    public DataIngestionTask(DatasetFiles files, OrchestratorProperties props) {
        this.files = files;
        this.props = props;
    }

    @Override
    public String stageName() {
        return StageRegistry.DATA_INGESTION;
    }

    @Override
    public int maxAttempts() {
        return props.stageRetry().ingestionAttempts();
    }

    @Override
    public List<Item> execute(GeneratedDataset input, StageExecutionContext ctx) throws Exception {
        log.info("Ingesting data from {}", input.file());
        List<Item> items = files.readItems(input.file());
        SimulatedWork.pause(props.simulatedDelay());
        log.info("Ingested {} records", items.size());
        return items;
    }

    @Override
    public Long recordsProcessed(List<Item> output) {
        return (long) output.size();
    }
}
