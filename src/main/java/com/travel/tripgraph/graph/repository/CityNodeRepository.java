package com.travel.tripgraph.graph.repository;

import com.travel.tripgraph.graph.node.CityNode;
import org.springframework.data.neo4j.repository.Neo4jRepository;
import org.springframework.data.neo4j.repository.query.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CityNodeRepository extends Neo4jRepository<CityNode, String> {

    long countByName(String name);

    @Query("MATCH (c:City) " +
           "RETURN c.name " +
           "ORDER BY c.name")
    List<String> findAllNames();
}
