package com.travel.tripgraph.dataset;

import java.util.Map;
import java.util.stream.Stream;

/**
 * Producer of raw TravelPlanner records (field name to raw value).
 *
 * Every call to {@link #open()} starts a fresh, lazy and finite pass over the corpus, so a source can be
 * re-read after a cancelled or failed run. Callers close the returned stream.
 */
public interface DatasetSource {

    /**
     * @throws com.travel.tripgraph.exception.SourceUnavailableException if the corpus cannot be reached
     */
    Stream<Map<String, Object>> open();

    default String describe() {
        return getClass().getSimpleName();
    }
}
