package com.travel.tripgraph.init;

import com.travel.tripgraph.dataset.DatasetSources;
import com.travel.tripgraph.dto.IngestionReport;
import com.travel.tripgraph.service.DatasetIngestionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Loads the configured dataset into the graph at startup.
 * Only active with travel.dataset.load-on-startup=true
 */
@Component
@ConditionalOnProperty(prefix = "travel.dataset", name = "load-on-startup", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class DatasetBootstrapRunner implements CommandLineRunner {

    private final DatasetIngestionService ingestionService;
    private final DatasetSources datasetSources;

    @Override
    public void run(String... args) {
        log.info("Loading dataset into the knowledge graph at startup...");
        IngestionReport report = ingestionService.ingest(datasetSources.resolve(null, null));
        if (!report.getSkipped().isEmpty()) {
            log.warn("Startup load skipped {} records", report.getSkipped().size());
            report.getSkipped().forEach(skipped ->
                    log.warn("  record {}: {}", skipped.getIndex(), skipped.getReason()));
        }
    }
}
