package com.datapipe.orchestrator.dataset;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads and writes the JSON files that carry the dataset between runs:
 * the generated input (array of items) and the export document.
 */
@Component
public class DatasetFiles {

    private static final TypeReference<List<Item>> ITEM_LIST_TYPE = new TypeReference<>() {};

    private final ObjectMapper json;

    public DatasetFiles(ObjectMapper objectMapper) {
        this.json = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void writeItems(Path file, List<Item> items) throws IOException {
        createParent(file);
        json.writeValue(file.toFile(), items);
    }

    /**
     * @throws NoSuchFileException if the file does not exist
     */
    public List<Item> readItems(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toString(), null, "file not found");
        }
        return json.readValue(file.toFile(), ITEM_LIST_TYPE);
    }

    public void writeExport(Path file, ExportDocument document) throws IOException {
        createParent(file);
        json.writeValue(file.toFile(), document);
    }

    public ExportDocument readExport(Path file) throws IOException {
        return json.readValue(file.toFile(), ExportDocument.class);
    }

    private static void createParent(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
