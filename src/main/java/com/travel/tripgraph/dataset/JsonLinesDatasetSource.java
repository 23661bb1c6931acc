package com.travel.tripgraph.dataset;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.travel.tripgraph.exception.RecordReadException;
import com.travel.tripgraph.exception.SourceUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/**
 * Reads records from a local JSON Lines export of the dataset, one object per line.
 * Blank lines are ignored; a line that is not a JSON object fails only that record.
 */
@Slf4j
public class JsonLinesDatasetSource implements DatasetSource {

    private static final TypeReference<Map<String, Object>> RECORD_TYPE = new TypeReference<>() {};

    private final Path path;
    private final ObjectMapper objectMapper;

    public JsonLinesDatasetSource(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper;
    }

    @Override
    public Stream<Map<String, Object>> open() {
        if (!Files.isReadable(path)) {
            throw new SourceUnavailableException("Dataset file is not readable: " + path.toAbsolutePath());
        }
        Stream<String> lines;
        try {
            lines = Files.lines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SourceUnavailableException("Could not open dataset file " + path.toAbsolutePath(), e);
        }
        log.info("Reading dataset records from {}", path.toAbsolutePath());

        AtomicLong lineNumber = new AtomicLong();
        return lines
                .peek(line -> lineNumber.incrementAndGet())
                .filter(line -> !line.isBlank())
                .map(line -> parseLine(line, lineNumber.get()))
                .onClose(lines::close);
    }

    private Map<String, Object> parseLine(String line, long lineNumber) {
        try {
            return objectMapper.readValue(line, RECORD_TYPE);
        } catch (JsonProcessingException e) {
            throw new RecordReadException("Line " + lineNumber + " of " + path.getFileName()
                    + " is not a JSON object: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public String describe() {
        return "file:" + path;
    }
}
