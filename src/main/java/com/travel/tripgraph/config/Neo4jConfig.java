package com.travel.tripgraph.config;

import org.neo4j.driver.Driver;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.neo4j.core.DatabaseSelectionProvider;
import org.springframework.data.neo4j.core.transaction.Neo4jTransactionManager;
import org.springframework.data.neo4j.repository.config.EnableNeo4jRepositories;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Graph repositories and the transaction manager that trip writes and lookups run under.
 * One record taken by the ingestion loop is exactly one transaction of this manager.
 */
@Configuration
@EnableNeo4jRepositories(
    basePackages = "com.travel.tripgraph.graph.repository",
    transactionManagerRef = "neo4jTransactionManager"
)
@EnableTransactionManagement
public class Neo4jConfig {

    /**
     * Bound to the same database selection as the auto-configured Neo4jClient,
     * so writer statements join the transaction opened around them
     */
    @Bean(name = "neo4jTransactionManager")
    public PlatformTransactionManager neo4jTransactionManager(Driver driver,
                                                             DatabaseSelectionProvider databaseSelectionProvider) {
        return new Neo4jTransactionManager(driver, databaseSelectionProvider);
    }
}
