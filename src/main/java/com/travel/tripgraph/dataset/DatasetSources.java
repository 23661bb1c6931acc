package com.travel.tripgraph.dataset;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.travel.tripgraph.config.DatasetProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Resolves a source name ("huggingface" or "file") to a {@link DatasetSource}
 */
@Component
@RequiredArgsConstructor
public class DatasetSources {

    public static final String HUGGING_FACE = "huggingface";
    public static final String FILE = "file";

    private final DatasetProperties properties;
    private final HuggingFaceDatasetSource huggingFaceSource;
    private final ObjectMapper objectMapper;

    /**
     * @param kind source name, or null for the configured default
     * @param path file to read for the "file" source, or null for the configured file path
     */
    public DatasetSource resolve(String kind, String path) {
        String selected = kind != null && !kind.isBlank() ? kind.trim().toLowerCase() : properties.getSource();
        switch (selected) {
            case HUGGING_FACE:
                return huggingFaceSource;
            case FILE:
                String file = path != null && !path.isBlank() ? path : properties.getFilePath();
                return new JsonLinesDatasetSource(Path.of(file), objectMapper);
            default:
                throw new IllegalArgumentException("Unknown dataset source: " + selected
                        + " (expected " + HUGGING_FACE + " or " + FILE + ")");
        }
    }
}
