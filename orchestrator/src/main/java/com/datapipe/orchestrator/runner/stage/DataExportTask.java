package com.datapipe.orchestrator.runner.stage;

import com.datapipe.orchestrator.config.OrchestratorProperties;
import com.datapipe.orchestrator.dataset.DatasetFiles;
import com.datapipe.orchestrator.dataset.ExportDocument;
import com.datapipe.orchestrator.dataset.Item;
import com.datapipe.orchestrator.registry.StageRegistry;
import com.datapipe.orchestrator.runner.StageExecutionContext;
import com.datapipe.orchestrator.runner.StageTask;
import com.datapipe.orchestrator.service.PipelineStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Stage 5: write the transformed records to the output directory and
 * record the file on the pipeline.
 */
@Component
public class DataExportTask implements StageTask<List<Item>, ExportedDataset> {

    private static final Logger log = LoggerFactory.getLogger(DataExportTask.class);

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final DatasetFiles           files;
    private final PipelineStore          store;
    private final OrchestratorProperties props;
    private final Clock                  clock;

    public DataExportTask(DatasetFiles files, PipelineStore store,
                          OrchestratorProperties props, Clock clock) {
        this.files = files;
        this.store = store;
        this.props = props;
        this.clock = clock;
    }

    @Override
    public String stageName() {
        return StageRegistry.DATA_EXPORT;
    }

    @Override
    public ExportedDataset execute(List<Item> input, StageExecutionContext ctx) throws Exception {
        LocalDateTime now = LocalDateTime.now(clock);
        Path file = props.outputDir().resolve(
                "pipeline_" + ctx.pipelineId() + "_results_" + now.format(FILE_TIMESTAMP) + ".json");

        files.writeExport(file, new ExportDocument(ctx.pipelineId(), now.toString(), input.size(), input));
        store.updatePipeline(ctx.pipelineId(), p -> p.setOutputFile(file.toString()));
        log.info("Exported {} records to {}", input.size(), file);

        SimulatedWork.pause(props.simulatedDelay());
        return new ExportedDataset(file, input.size());
    }

    @Override
    public Long recordsProcessed(ExportedDataset output) {
        return (long) output.recordCount();
    }
}
