package com.travel.tripgraph.graph.node;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.neo4j.core.schema.GeneratedValue;
import org.springframework.data.neo4j.core.schema.Id;
import org.springframework.data.neo4j.core.schema.Node;
import org.springframework.data.neo4j.core.schema.Property;

/**
 * Read model of a TripPlan node.
 * Only the scalar attributes are mapped; day plans and references are reachable through the raw
 * annotated_plan / reference_information payloads kept on the node.
 */
@Node("TripPlan")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TripPlanNode {

    @Id
    @GeneratedValue
    private Long id;

    private String org;
    private String dest;
    private Integer days;

    @Property("visiting_city_number")
    private Integer visitingCityNumber;

    private String date; // raw encoded list of travel dates

    @Property("people_number")
    private Integer peopleNumber;

    @Property("local_constraint")
    private String localConstraint;

    private Double budget;
    private String query;
    private String level;

    @Property("annotated_plan")
    private String annotatedPlan;

    @Property("reference_information")
    private String referenceInformation;
}
