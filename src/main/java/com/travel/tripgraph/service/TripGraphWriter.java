package com.travel.tripgraph.service;

import com.travel.tripgraph.dto.NormalizedDayPlan;
import com.travel.tripgraph.dto.NormalizedReference;
import com.travel.tripgraph.dto.NormalizedTrip;
import com.travel.tripgraph.exception.TripWriteException;
import com.travel.tripgraph.graph.node.ActivityKind;
import com.travel.tripgraph.graph.node.ActivitySlot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.neo4j.core.Neo4jClient;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes one normalized trip into the knowledge graph.
 *
 * Graph shape per record:
 * (City)<-[:ORIGIN]-(TripPlan)-[:DESTINATION]->(City)
 * (TripPlan)-[:HAS_DAY_PLAN]->(DayPlan)-[:IN_CITY]->(City)
 * (DayPlan)-[:HAS_TRANSPORTATION|HAS_MEAL|HAS_ATTRACTION|HAS_ACCOMMODATION]->(activity)
 * (TripPlan)-[:HAS_REFERENCE]->(ReferenceInfo)
 *
 * Cities are merged by name; everything else is created fresh for each record.
 * The whole record is written in one Neo4j transaction, so a failure in any step leaves nothing behind.
 */
@Service
@Slf4j
public class TripGraphWriter {

    static final String MERGE_CITY =
            "MERGE (c:City {name: $name})";

    static final String CREATE_TRIP_PLAN =
            "CREATE (tp:TripPlan $props) " +
            "RETURN elementId(tp) AS id";

    static final String LINK_ORIGIN_AND_DESTINATION =
            "MATCH (tp:TripPlan) WHERE elementId(tp) = $tripId " +
            "MATCH (o:City {name: $origin}) " +
            "MATCH (d:City {name: $destination}) " +
            "CREATE (tp)-[:ORIGIN]->(o) " +
            "CREATE (tp)-[:DESTINATION]->(d) " +
            "RETURN count(tp) AS linked";

    static final String CREATE_DAY_PLAN =
            "MATCH (tp:TripPlan) WHERE elementId(tp) = $tripId " +
            "CREATE (dp:DayPlan {day: $day, current_city: $currentCity}) " +
            "CREATE (tp)-[:HAS_DAY_PLAN]->(dp) " +
            "RETURN elementId(dp) AS id";

    static final String LINK_DAY_PLAN_CITY =
            "MATCH (dp:DayPlan) WHERE elementId(dp) = $dayPlanId " +
            "MERGE (c:City {name: $city}) " +
            "CREATE (dp)-[:IN_CITY]->(c)";

    static final String CREATE_REFERENCE =
            "MATCH (tp:TripPlan) WHERE elementId(tp) = $tripId " +
            "CREATE (ri:ReferenceInfo {description: $description, content: $content}) " +
            "CREATE (tp)-[:HAS_REFERENCE]->(ri)";

    /**
     * One statement per activity kind, built from the enum constants only
     */
    private static final Map<ActivityKind, String> CREATE_ACTIVITY = buildActivityStatements();

    private final Neo4jClient neo4jClient;

    public TripGraphWriter(Neo4jClient neo4jClient) {
        this.neo4jClient = neo4jClient;
    }

    /**
     * Materialize the trip subgraph.
     *
     * @return element id of the created TripPlan node
     * @throws TripWriteException when a step matched nothing; the transaction is rolled back
     */
    @Transactional(transactionManager = "neo4jTransactionManager")
    public String write(NormalizedTrip trip) {
        mergeCity(trip.getOrigin());
        mergeCity(trip.getDestination());

        String tripId = createTripPlan(trip);
        linkOriginAndDestination(tripId, trip.getOrigin(), trip.getDestination());

        for (NormalizedDayPlan dayPlan : trip.getDayPlans()) {
            writeDayPlan(tripId, dayPlan);
        }
        for (NormalizedReference reference : trip.getReferences()) {
            writeReference(tripId, reference);
        }

        log.debug("Wrote trip {} -> {} ({} day plans, {} references)",
                trip.getOrigin(), trip.getDestination(), trip.getDayPlans().size(), trip.getReferences().size());
        return tripId;
    }

    protected void mergeCity(String name) {
        neo4jClient.query(MERGE_CITY)
                .bind(name).to("name")
                .run();
    }

    protected String createTripPlan(NormalizedTrip trip) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("org", trip.getOrigin());
        props.put("dest", trip.getDestination());
        props.put("days", trip.getDays());
        props.put("visiting_city_number", trip.getVisitingCityNumber());
        props.put("date", trip.getDate());
        props.put("people_number", trip.getPeopleNumber());
        props.put("local_constraint", trip.getLocalConstraint());
        props.put("budget", trip.getBudget());
        props.put("query", trip.getQuery());
        props.put("level", trip.getLevel());
        props.put("annotated_plan", trip.getRawAnnotatedPlan());
        props.put("reference_information", trip.getRawReferenceInformation());

        return neo4jClient.query(CREATE_TRIP_PLAN)
                .bind(props).to("props")
                .fetchAs(String.class)
                .mappedBy((typeSystem, record) -> record.get("id").asString())
                .one()
                .orElseThrow(() -> new TripWriteException("TripPlan node was not created"));
    }

    protected void linkOriginAndDestination(String tripId, String origin, String destination) {
        Map<String, Object> params = new HashMap<>();
        params.put("tripId", tripId);
        params.put("origin", origin);
        params.put("destination", destination);

        long linked = neo4jClient.query(LINK_ORIGIN_AND_DESTINATION)
                .bindAll(params)
                .fetchAs(Long.class)
                .mappedBy((typeSystem, record) -> record.get("linked").asLong())
                .one()
                .orElse(0L);
        if (linked != 1L) {
            throw new TripWriteException("Could not link TripPlan to cities " + origin + " / " + destination);
        }
    }

    protected void writeDayPlan(String tripId, NormalizedDayPlan dayPlan) {
        Map<String, Object> params = new HashMap<>();
        params.put("tripId", tripId);
        params.put("day", dayPlan.getDayIndex());
        params.put("currentCity", dayPlan.getCurrentCity());

        String dayPlanId = neo4jClient.query(CREATE_DAY_PLAN)
                .bindAll(params)
                .fetchAs(String.class)
                .mappedBy((typeSystem, record) -> record.get("id").asString())
                .one()
                .orElseThrow(() -> new TripWriteException("DayPlan node was not created for trip " + tripId));

        if (TripRecordNormalizer.isPresent(dayPlan.getCurrentCity())) {
            neo4jClient.query(LINK_DAY_PLAN_CITY)
                    .bind(dayPlanId).to("dayPlanId")
                    .bind(dayPlan.getCurrentCity()).to("city")
                    .run();
        }

        for (Map.Entry<ActivitySlot, String> activity : dayPlan.getActivities().entrySet()) {
            writeActivity(dayPlanId, activity.getKey(), activity.getValue());
        }
    }

    protected void writeActivity(String dayPlanId, ActivitySlot slot, String value) {
        Map<String, Object> params = new HashMap<>();
        params.put("dayPlanId", dayPlanId);
        params.put("value", value);
        if (slot.getKind() == ActivityKind.MEAL) {
            params.put("mealType", slot.getMealType());
        }
        neo4jClient.query(CREATE_ACTIVITY.get(slot.getKind()))
                .bindAll(params)
                .run();
    }

    protected void writeReference(String tripId, NormalizedReference reference) {
        Map<String, Object> params = new HashMap<>();
        params.put("tripId", tripId);
        params.put("description", reference.getDescription());
        params.put("content", reference.getContent());
        neo4jClient.query(CREATE_REFERENCE)
                .bindAll(params)
                .run();
    }

    private static Map<ActivityKind, String> buildActivityStatements() {
        Map<ActivityKind, String> statements = new EnumMap<>(ActivityKind.class);
        for (ActivityKind kind : ActivityKind.values()) {
            String properties = kind == ActivityKind.MEAL
                    ? "{value: $value, meal_type: $mealType}"
                    : "{value: $value}";
            statements.put(kind,
                    "MATCH (dp:DayPlan) WHERE elementId(dp) = $dayPlanId " +
                    "CREATE (n:" + kind.getLabel() + " " + properties + ") " +
                    "CREATE (dp)-[:" + kind.getRelationshipType() + "]->(n)");
        }
        return Collections.unmodifiableMap(statements);
    }
}
