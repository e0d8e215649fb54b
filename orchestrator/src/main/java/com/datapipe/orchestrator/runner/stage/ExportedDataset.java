package com.datapipe.orchestrator.runner.stage;

import java.nio.file.Path;

/** Output of the export stage, the last one in the run. */
public record ExportedDataset(Path file, int recordCount) {}
