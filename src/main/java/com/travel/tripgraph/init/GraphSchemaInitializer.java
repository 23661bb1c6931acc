package com.travel.tripgraph.init;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.data.neo4j.core.Neo4jClient;
import org.springframework.stereotype.Component;

/**
 * Creates the City name uniqueness constraint before any record is ingested.
 * Together with MERGE it guarantees one City per name even when records are written concurrently.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@RequiredArgsConstructor
@Slf4j
public class GraphSchemaInitializer implements ApplicationRunner {

    static final String CITY_NAME_CONSTRAINT =
            "CREATE CONSTRAINT city_name_unique IF NOT EXISTS " +
            "FOR (c:City) REQUIRE c.name IS UNIQUE";

    private final Neo4jClient neo4jClient;

    @Override
    public void run(ApplicationArguments args) {
        neo4jClient.query(CITY_NAME_CONSTRAINT).run();
        log.info("Ensured graph constraint city_name_unique");
    }
}
