package com.travel.tripgraph.service;

import com.travel.tripgraph.dataset.DatasetSource;
import com.travel.tripgraph.dto.IngestionReport;
import com.travel.tripgraph.dto.NormalizedReference;
import com.travel.tripgraph.exception.TripWriteException;
import com.travel.tripgraph.support.AbstractGraphIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.data.neo4j.core.Neo4jClient;

import java.util.HashMap;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * A record whose write fails part-way must leave no trace in the graph
 */
class TripGraphWriterAtomicityTest extends AbstractGraphIntegrationTest {

    private static final String FAILING_REFERENCE = "explode";

    static class FailingTripGraphWriter extends TripGraphWriter {

        FailingTripGraphWriter(Neo4jClient neo4jClient) {
            super(neo4jClient);
        }

        @Override
        protected void writeReference(String tripId, NormalizedReference reference) {
            if (FAILING_REFERENCE.equals(reference.getDescription())) {
                throw new TripWriteException("Simulated failure writing reference for trip " + tripId);
            }
            super.writeReference(tripId, reference);
        }
    }

    @TestConfiguration
    static class FailingWriterConfig {

        @Bean
        @Primary
        TripGraphWriter failingTripGraphWriter(Neo4jClient neo4jClient) {
            return new FailingTripGraphWriter(neo4jClient);
        }
    }

    @Autowired
    private DatasetIngestionService ingestionService;

    @Autowired
    private TripQueryService queryService;

    @Test
    void testFailedRecordIsRolledBackAndSkipped() {
        DatasetSource source = () -> Stream.of(
                record("Atlanta", "Miami", "[]"),
                record("Rollback City", "Nowhere",
                        "[{'Description': 'Flights', 'Content': 'F1'}, {'Description': 'explode', 'Content': 'x'}]"),
                record("Atlanta", "Orlando", "[{'Description': 'Flights', 'Content': 'F2'}]"));

        IngestionReport report = ingestionService.ingest(source);

        assertEquals(IngestionReport.Outcome.COMPLETED, report.getOutcome());
        assertEquals(3, report.getProcessed());
        assertEquals(2, report.getWritten());
        assertEquals(1, report.getSkipped().size());
        assertEquals(1L, report.getSkipped().get(0).getIndex());
        assertTrue(report.getSkipped().get(0).getReason().contains("Simulated failure"));

        assertEquals(2L, count("MATCH (t:TripPlan) RETURN count(t)"));
        assertEquals(0L, count("MATCH (c:City) WHERE c.name IN ['Rollback City', 'Nowhere'] RETURN count(c)"));
        assertEquals(0L, count("MATCH (r:ReferenceInfo {content: 'F1'}) RETURN count(r)"));
        assertEquals(1L, count("MATCH (r:ReferenceInfo {content: 'F2'}) RETURN count(r)"));
        assertTrue(queryService.lookupByOrigin("Rollback City").isEmpty());
    }

    @Test
    void testEveryTripPlanHasBothCityEdges() {
        DatasetSource source = () -> Stream.of(
                record("Dallas", "Houston", "[{'Description': 'explode', 'Content': 'x'}]"),
                record("Dallas", "Austin", "[]"));

        ingestionService.ingest(source);

        assertEquals(0L, count("MATCH (t:TripPlan) WHERE NOT (t)-[:ORIGIN]->(:City) "
                + "OR NOT (t)-[:DESTINATION]->(:City) RETURN count(t)"));
        assertEquals(1L, count("MATCH (t:TripPlan) RETURN count(t)"));
    }

    private static Map<String, Object> record(String origin, String destination, String references) {
        Map<String, Object> record = new HashMap<>();
        record.put("org", origin);
        record.put("dest", destination);
        record.put("days", 3);
        record.put("annotated_plan", "[{'days': 1, 'current_city': '" + origin + "', 'lunch': 'Diner, " + origin + "'}]");
        record.put("reference_information", references);
        return record;
    }
}
