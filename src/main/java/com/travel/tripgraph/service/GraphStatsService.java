package com.travel.tripgraph.service;

import com.travel.tripgraph.graph.node.ActivityKind;
import lombok.RequiredArgsConstructor;
import org.springframework.data.neo4j.core.Neo4jClient;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class GraphStatsService {

    public static final List<String> LABELS = graphLabels();

    private final Neo4jClient neo4jClient;

    /**
     * Node count per label of the trip graph, in schema order
     */
    @Transactional(transactionManager = "neo4jTransactionManager", readOnly = true)
    public Map<String, Long> nodeCounts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (String label : LABELS) {
            counts.put(label, countNodes(label));
        }
        return counts;
    }

    @Transactional(transactionManager = "neo4jTransactionManager", readOnly = true)
    public long countNodes(String label) {
        if (!LABELS.contains(label)) {
            throw new IllegalArgumentException("Not a trip graph label: " + label);
        }
        return neo4jClient.query("MATCH (n:" + label + ") RETURN count(n) AS total")
                .fetchAs(Long.class)
                .mappedBy((typeSystem, record) -> record.get("total").asLong())
                .one()
                .orElse(0L);
    }

    private static List<String> graphLabels() {
        List<String> labels = new ArrayList<>(List.of("City", "TripPlan", "DayPlan"));
        for (ActivityKind kind : ActivityKind.values()) {
            labels.add(kind.getLabel());
        }
        labels.add("ReferenceInfo");
        return Collections.unmodifiableList(labels);
    }
}
