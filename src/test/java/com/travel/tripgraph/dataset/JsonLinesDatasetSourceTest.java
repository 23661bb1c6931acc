package com.travel.tripgraph.dataset;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.travel.tripgraph.exception.RecordReadException;
import com.travel.tripgraph.exception.SourceUnavailableException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class JsonLinesDatasetSourceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    @Test
    void testReadsOneRecordPerLine() throws IOException {
        Path file = tempDir.resolve("train.jsonl");
        Files.writeString(file,
                "{\"org\": \"New York\", \"dest\": \"Chicago\", \"days\": 3}\n"
                + "\n"
                + "{\"org\": \"Boston\", \"dest\": \"Denver\", \"days\": 5}\n");
        JsonLinesDatasetSource source = new JsonLinesDatasetSource(file, objectMapper);

        List<Map<String, Object>> records;
        try (Stream<Map<String, Object>> stream = source.open()) {
            records = stream.collect(Collectors.toList());
        }

        assertEquals(2, records.size());
        assertEquals("New York", records.get(0).get("org"));
        assertEquals(5, records.get(1).get("days"));
    }

    @Test
    void testSourceCanBeReopened() throws IOException {
        Path file = tempDir.resolve("train.jsonl");
        Files.writeString(file, "{\"org\": \"Austin\"}\n");
        JsonLinesDatasetSource source = new JsonLinesDatasetSource(file, objectMapper);

        try (Stream<Map<String, Object>> first = source.open()) {
            assertEquals(1, first.count());
        }
        try (Stream<Map<String, Object>> second = source.open()) {
            assertEquals(1, second.count());
        }
    }

    @Test
    void testBadLineFailsOnlyThatRecord() throws IOException {
        Path file = tempDir.resolve("train.jsonl");
        Files.writeString(file, "{\"org\": \"A\"}\nnot json\n{\"org\": \"B\"}\n");
        JsonLinesDatasetSource source = new JsonLinesDatasetSource(file, objectMapper);

        try (Stream<Map<String, Object>> stream = source.open()) {
            Iterator<Map<String, Object>> iterator = stream.iterator();
            assertEquals("A", iterator.next().get("org"));
            RecordReadException e = assertThrows(RecordReadException.class, iterator::next);
            assertTrue(e.getMessage().startsWith("Line 2 of train.jsonl"));
            assertEquals("B", iterator.next().get("org"));
            assertFalse(iterator.hasNext());
        }
    }

    @Test
    void testMissingFileIsUnavailable() {
        JsonLinesDatasetSource source = new JsonLinesDatasetSource(tempDir.resolve("missing.jsonl"), objectMapper);

        assertThrows(SourceUnavailableException.class, source::open);
    }
}
