package com.travel.tripgraph.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One dataset record after normalization: typed scalar fields, the raw nested payloads
 * kept verbatim, and the day plans / references decoded from them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NormalizedTrip {

    private String origin;
    private String destination;
    private int days;
    private int visitingCityNumber;
    private String date;
    private int peopleNumber;
    private String localConstraint;
    private double budget;
    private String query;
    private String level;

    private String rawAnnotatedPlan;
    private String rawReferenceInformation;

    @Builder.Default
    private List<NormalizedDayPlan> dayPlans = new ArrayList<>();

    @Builder.Default
    private List<NormalizedReference> references = new ArrayList<>();

    /**
     * Malformed-data findings recovered with defaults while normalizing this record
     */
    @Builder.Default
    private List<String> issues = new ArrayList<>();

    public boolean isMalformed() {
        return !issues.isEmpty();
    }
}
