package com.travel.tripgraph.controller;

import com.travel.tripgraph.dto.TripSearchResult;
import com.travel.tripgraph.dto.TripSummary;
import com.travel.tripgraph.service.TripInsightService;
import com.travel.tripgraph.service.TripQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API for looking up reference trips in the knowledge graph
 */
@RestController
@RequestMapping("/api/trips")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Trips", description = "Origin/destination lookups over ingested trip plans")
public class TripController {

    private final TripQueryService tripQueryService;
    private final TripInsightService tripInsightService;

    @Operation(
        summary = "Trips between two cities",
        description = "Case-insensitive exact match on the trip's origin and destination"
    )
    @GetMapping
    public List<TripSummary> findByOriginAndDestination(
            @Parameter(description = "Origin city") @RequestParam String origin,
            @Parameter(description = "Destination city") @RequestParam String destination) {
        return tripQueryService.lookupByOriginDestination(origin, destination);
    }

    @Operation(summary = "Trips leaving a city")
    @GetMapping("/origin/{origin}")
    public List<TripSummary> findByOrigin(@PathVariable String origin) {
        return tripQueryService.lookupByOrigin(origin);
    }

    /**
     * Lookup used by itinerary generation: falls back to origin-only trips and adds budget/length hints
     */
    @Operation(
        summary = "Search reference trips",
        description = "Origin+destination lookup that broadens to any destination from the origin when nothing matches. " +
                "Budget and days, when given, add rule-based planning hints."
    )
    @GetMapping("/search")
    public TripSearchResult search(
            @Parameter(description = "Origin city") @RequestParam(required = false) String origin,
            @Parameter(description = "Destination city") @RequestParam(required = false) String destination,
            @Parameter(description = "Total budget in USD") @RequestParam(required = false) Double budget,
            @Parameter(description = "Trip length in days") @RequestParam(required = false) Integer days) {
        log.info("Trip search: origin={}, destination={}, budget={}, days={}", origin, destination, budget, days);
        TripSearchResult result = tripQueryService.search(origin, destination);
        result.setInsights(tripInsightService.insights(budget, days));
        return result;
    }
}
