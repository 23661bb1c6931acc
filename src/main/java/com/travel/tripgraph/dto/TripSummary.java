package com.travel.tripgraph.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.travel.tripgraph.graph.node.TripPlanNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Flat projection of a TripPlan returned by trip lookups.
 * Field names on the wire follow the dataset's own keys.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TripSummary {

    @JsonProperty("org")
    private String origin;

    @JsonProperty("dest")
    private String destination;

    private Integer days;
    private String date;

    @JsonProperty("people_number")
    private Integer peopleNumber;

    private Double budget;

    @JsonProperty("query_text")
    private String queryText;

    private String level;

    @JsonProperty("annotated_plan")
    private String annotatedPlan;

    @JsonProperty("reference_information")
    private String referenceInformation;

    public static TripSummary from(TripPlanNode node) {
        return TripSummary.builder()
                .origin(node.getOrg())
                .destination(node.getDest())
                .days(node.getDays())
                .date(node.getDate())
                .peopleNumber(node.getPeopleNumber())
                .budget(node.getBudget())
                .queryText(node.getQuery())
                .level(node.getLevel())
                .annotatedPlan(node.getAnnotatedPlan())
                .referenceInformation(node.getReferenceInformation())
                .build();
    }
}
