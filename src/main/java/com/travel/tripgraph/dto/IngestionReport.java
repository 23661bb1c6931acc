package com.travel.tripgraph.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one dataset ingestion run.
 * Skipped records are listed with their reason so a run with losses is distinguishable from a clean one.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionReport {

    public enum Outcome { COMPLETED, CANCELLED }

    private String source;
    private Outcome outcome;

    /**
     * Records taken from the source, whether written or skipped
     */
    private int processed;

    private int written;

    /**
     * Records that needed defaults or lost a nested payload while being normalized
     */
    private int malformed;

    @Builder.Default
    private List<SkippedRecord> skipped = new ArrayList<>();

    private long durationMs;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SkippedRecord {
        private long index;
        private String reason;
    }
}
