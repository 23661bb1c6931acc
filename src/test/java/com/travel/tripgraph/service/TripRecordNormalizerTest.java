package com.travel.tripgraph.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.travel.tripgraph.dto.NormalizedDayPlan;
import com.travel.tripgraph.dto.NormalizedTrip;
import com.travel.tripgraph.graph.node.ActivitySlot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TripRecordNormalizerTest {

    private TripRecordNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new TripRecordNormalizer(new LiteralStructureDecoder(), new ObjectMapper());
    }

    @Test
    void testNormalizeCompleteRecord() {
        Map<String, Object> record = new HashMap<>();
        record.put("org", "New York");
        record.put("dest", "Chicago");
        record.put("days", 3);
        record.put("visiting_city_number", 1);
        record.put("date", "['2022-03-01', '2022-03-02', '2022-03-03']");
        record.put("people_number", 2);
        record.put("local_constraint", "{'house rule': None, 'cuisine': None}");
        record.put("budget", 1200);
        record.put("query", "A 3-day trip from New York to Chicago");
        record.put("level", "easy");
        record.put("annotated_plan", "[{'days': 1, 'current_city': 'from New York to Chicago', "
                + "'transportation': 'Flight F1', 'breakfast': '-', 'lunch': 'Deep Dish Co, Chicago', "
                + "'dinner': '-', 'attraction': 'Millennium Park, Chicago', 'accommodation': '-'}]");
        record.put("reference_information", "[{'Description': 'Flights', 'Content': 'F1 09:00'}]");

        NormalizedTrip trip = normalizer.normalize(record);

        assertEquals("New York", trip.getOrigin());
        assertEquals("Chicago", trip.getDestination());
        assertEquals(3, trip.getDays());
        assertEquals(1200.0, trip.getBudget());
        assertEquals("easy", trip.getLevel());
        assertFalse(trip.isMalformed());

        assertEquals(1, trip.getDayPlans().size());
        NormalizedDayPlan day = trip.getDayPlans().get(0);
        assertEquals(1, day.getDayIndex());
        assertEquals("from New York to Chicago", day.getCurrentCity());
        assertEquals("Flight F1", day.getActivities().get(ActivitySlot.TRANSPORTATION));
        assertEquals("Deep Dish Co, Chicago", day.getActivities().get(ActivitySlot.LUNCH));
        assertFalse(day.getActivities().containsKey(ActivitySlot.BREAKFAST));
        assertFalse(day.getActivities().containsKey(ActivitySlot.ACCOMMODATION));

        assertEquals(1, trip.getReferences().size());
        assertEquals("Flights", trip.getReferences().get(0).getDescription());
    }

    @Test
    void testMissingFieldsTakeDefaults() {
        NormalizedTrip trip = normalizer.normalize(new HashMap<>());

        assertEquals(TripRecordNormalizer.UNKNOWN_CITY, trip.getOrigin());
        assertEquals(TripRecordNormalizer.UNKNOWN_CITY, trip.getDestination());
        assertEquals(0, trip.getDays());
        assertEquals(0.0, trip.getBudget());
        assertEquals("[]", trip.getDate());
        assertEquals("{}", trip.getLocalConstraint());
        assertEquals("", trip.getQuery());
        assertEquals(TripRecordNormalizer.UNKNOWN_LEVEL, trip.getLevel());
        assertTrue(trip.getDayPlans().isEmpty());
        assertTrue(trip.getReferences().isEmpty());
    }

    @Test
    void testUndecodablePlanIsRecordedAsIssue() {
        Map<String, Object> record = new HashMap<>();
        record.put("org", "Boston");
        record.put("dest", "Denver");
        record.put("annotated_plan", "[{'days': 1,");
        record.put("reference_information", "[]");

        NormalizedTrip trip = normalizer.normalize(record);

        assertTrue(trip.isMalformed());
        assertTrue(trip.getDayPlans().isEmpty());
        assertTrue(trip.getIssues().contains("annotated_plan is not a decodable list"));
    }

    @Test
    void testNumericStringsAreParsed() {
        Map<String, Object> record = new HashMap<>();
        record.put("budget", "$1,900");
        record.put("days", "5");
        record.put("people_number", "many");

        NormalizedTrip trip = normalizer.normalize(record);

        assertEquals(1900.0, trip.getBudget());
        assertEquals(5, trip.getDays());
        assertEquals(0, trip.getPeopleNumber());
        assertTrue(trip.getIssues().stream().anyMatch(issue -> issue.startsWith("people_number")));
    }

    @Test
    void testStructuredPayloadsAreUsedDirectly() {
        Map<String, Object> day = new HashMap<>();
        day.put("days", 2);
        day.put("current_city", "Chicago");
        day.put("dinner", "Lou's, Chicago");
        Map<String, Object> record = new HashMap<>();
        record.put("annotated_plan", List.of(day));
        record.put("reference_information", List.of(Map.of("Description", "Restaurants")));

        NormalizedTrip trip = normalizer.normalize(record);

        assertEquals(1, trip.getDayPlans().size());
        assertEquals("Lou's, Chicago", trip.getDayPlans().get(0).getActivities().get(ActivitySlot.DINNER));
        assertTrue(trip.getRawAnnotatedPlan().startsWith("["));
        // references need both Description and Content
        assertTrue(trip.getReferences().isEmpty());
    }

    @Test
    void testIsPresent() {
        assertTrue(TripRecordNormalizer.isPresent("Chicago"));
        assertFalse(TripRecordNormalizer.isPresent("-"));
        assertFalse(TripRecordNormalizer.isPresent(" - "));
        assertFalse(TripRecordNormalizer.isPresent(""));
        assertFalse(TripRecordNormalizer.isPresent(null));
    }
}
