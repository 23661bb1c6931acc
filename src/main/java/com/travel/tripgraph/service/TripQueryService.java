package com.travel.tripgraph.service;

import com.travel.tripgraph.dto.TripSearchResult;
import com.travel.tripgraph.dto.TripSummary;
import com.travel.tripgraph.graph.repository.TripPlanNodeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Read side of the trip graph.
 * City names are compared case-insensitively against the org/dest values stored on each TripPlan.
 * No match is an empty list, never an error.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TripQueryService {

    private final TripPlanNodeRepository tripPlanNodeRepository;

    @Transactional(transactionManager = "neo4jTransactionManager", readOnly = true)
    public List<TripSummary> lookupByOriginDestination(String origin, String destination) {
        if (isBlank(origin) || isBlank(destination)) {
            return Collections.emptyList();
        }
        List<TripSummary> trips = tripPlanNodeRepository.findTripsByOriginAndDestination(origin.trim(), destination.trim())
                .stream()
                .map(TripSummary::from)
                .collect(Collectors.toList());
        log.debug("Found {} trips from {} to {}", trips.size(), origin, destination);
        return trips;
    }

    @Transactional(transactionManager = "neo4jTransactionManager", readOnly = true)
    public List<TripSummary> lookupByOrigin(String origin) {
        if (isBlank(origin)) {
            return Collections.emptyList();
        }
        List<TripSummary> trips = tripPlanNodeRepository.findTripsByOrigin(origin.trim())
                .stream()
                .map(TripSummary::from)
                .collect(Collectors.toList());
        log.debug("Found {} trips from {}", trips.size(), origin);
        return trips;
    }

    /**
     * Origin+destination lookup that broadens to origin-only when it finds nothing.
     * Without a destination only the origin lookup runs.
     *
     * @throws IllegalArgumentException if origin is blank
     */
    @Transactional(transactionManager = "neo4jTransactionManager", readOnly = true)
    public TripSearchResult search(String origin, String destination) {
        if (isBlank(origin)) {
            throw new IllegalArgumentException("Origin city is required");
        }

        if (isBlank(destination)) {
            return TripSearchResult.builder()
                    .origin(origin)
                    .trips(lookupByOrigin(origin))
                    .build();
        }

        List<TripSummary> trips = lookupByOriginDestination(origin, destination);
        if (!trips.isEmpty()) {
            return TripSearchResult.builder()
                    .origin(origin)
                    .destination(destination)
                    .trips(trips)
                    .build();
        }

        log.info("No trips from {} to {}, falling back to trips from {} to any destination",
                origin, destination, origin);
        return TripSearchResult.builder()
                .origin(origin)
                .destination(destination)
                .fallbackApplied(true)
                .trips(lookupByOrigin(origin))
                .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
