package com.datapipe.orchestrator.runner.stage;

import java.nio.file.Path;

/** Output of the generation stage. */
public record GeneratedDataset(Path file, int recordCount) {}
