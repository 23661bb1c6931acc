package com.travel.tripgraph.graph.repository;

import com.travel.tripgraph.graph.node.TripPlanNode;
import org.springframework.data.neo4j.repository.Neo4jRepository;
import org.springframework.data.neo4j.repository.query.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Trip lookups match the org/dest attributes copied onto the TripPlan node,
 * not the ORIGIN/DESTINATION City nodes, which keeps every lookup a single-label scan.
 * Both sides are trimmed and lower-cased, so padding in the dataset never hides a trip.
 */
@Repository
public interface TripPlanNodeRepository extends Neo4jRepository<TripPlanNode, Long> {

    @Query("MATCH (t:TripPlan) " +
           "WHERE toLower(trim(t.org)) = toLower(trim($origin)) " +
           "AND toLower(trim(t.dest)) = toLower(trim($destination)) " +
           "RETURN t")
    List<TripPlanNode> findTripsByOriginAndDestination(
            @Param("origin") String origin,
            @Param("destination") String destination);

    @Query("MATCH (t:TripPlan) " +
           "WHERE toLower(trim(t.org)) = toLower(trim($origin)) " +
           "RETURN t")
    List<TripPlanNode> findTripsByOrigin(@Param("origin") String origin);
}
