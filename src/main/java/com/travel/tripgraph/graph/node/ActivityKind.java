package com.travel.tripgraph.graph.node;

/**
 * Closed set of activity node kinds hanging off a DayPlan.
 * Each kind fixes both the node label and the relationship type used to attach it,
 * so no part of the graph schema is ever derived from record content.
 */
public enum ActivityKind {

    TRANSPORTATION("Transportation", "HAS_TRANSPORTATION"),
    MEAL("Meal", "HAS_MEAL"),
    ATTRACTION("Attraction", "HAS_ATTRACTION"),
    ACCOMMODATION("Accommodation", "HAS_ACCOMMODATION");

    private final String label;
    private final String relationshipType;

    ActivityKind(String label, String relationshipType) {
        this.label = label;
        this.relationshipType = relationshipType;
    }

    public String getLabel() {
        return label;
    }

    public String getRelationshipType() {
        return relationshipType;
    }
}
