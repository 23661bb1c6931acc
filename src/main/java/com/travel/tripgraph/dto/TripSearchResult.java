package com.travel.tripgraph.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TripSearchResult {

    private String origin;
    private String destination;

    /**
     * True when the origin+destination lookup found nothing and the trips come from the origin-only lookup
     */
    private boolean fallbackApplied;

    @Builder.Default
    private List<TripSummary> trips = new ArrayList<>();

    private TripInsights insights;
}
