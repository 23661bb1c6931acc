package com.travel.tripgraph.controller;

import com.travel.tripgraph.dataset.DatasetSource;
import com.travel.tripgraph.dataset.DatasetSources;
import com.travel.tripgraph.dto.IngestionReport;
import com.travel.tripgraph.service.DatasetIngestionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Admin operations for loading the dataset into the graph
 */
@RestController
@RequestMapping("/api/admin/ingest")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Ingestion", description = "Dataset loading into the knowledge graph")
public class IngestionController {

    private final DatasetIngestionService ingestionService;
    private final DatasetSources datasetSources;

    /**
     * Runs the ingestion in the request thread and returns its report once the run ends
     */
    @Operation(
        summary = "Ingest dataset",
        description = "Loads records from the Hugging Face dataset or a local JSON Lines file. " +
                "Each record is written in its own transaction; failed records are skipped and listed in the report."
    )
    @PostMapping
    public IngestionReport ingest(
            @Parameter(description = "huggingface or file (default from configuration)") @RequestParam(required = false) String source,
            @Parameter(description = "JSON Lines file for the file source") @RequestParam(required = false) String path,
            @Parameter(description = "Maximum records, 0 for all") @RequestParam(defaultValue = "0") long limit) {
        DatasetSource datasetSource = datasetSources.resolve(source, path);
        log.info("Ingestion triggered via API from {}", datasetSource.describe());
        return ingestionService.ingest(datasetSource, limit);
    }

    @Operation(summary = "Cancel the running ingestion before its next record")
    @PostMapping("/cancel")
    public ResponseEntity<Map<String, Object>> cancel() {
        boolean cancelled = ingestionService.cancel();
        return ResponseEntity.ok(Map.of("cancelRequested", cancelled));
    }

    @GetMapping("/status")
    public Map<String, Object> status() {
        return Map.of("running", ingestionService.isRunning());
    }
}
