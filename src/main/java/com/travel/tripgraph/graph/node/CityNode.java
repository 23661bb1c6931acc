package com.travel.tripgraph.graph.node;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.neo4j.core.schema.Id;
import org.springframework.data.neo4j.core.schema.Node;

/**
 * Shared city entity. The name is the identity (case-sensitive, unique constraint city_name_unique),
 * so origin, destination and day-plan cities spelled the same resolve to one node.
 */
@Node("City")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CityNode {

    @Id
    private String name;
}
