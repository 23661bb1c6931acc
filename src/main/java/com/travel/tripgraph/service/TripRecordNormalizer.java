package com.travel.tripgraph.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.travel.tripgraph.dto.NormalizedDayPlan;
import com.travel.tripgraph.dto.NormalizedReference;
import com.travel.tripgraph.dto.NormalizedTrip;
import com.travel.tripgraph.graph.node.ActivitySlot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a raw TravelPlanner record into a {@link NormalizedTrip}.
 *
 * Never fails on bad data: missing scalars take their defaults, numbers that do not parse become 0,
 * and a nested payload that does not decode contributes no day plans / references. Every such
 * recovery is noted in {@link NormalizedTrip#getIssues()}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TripRecordNormalizer {

    public static final String UNKNOWN_CITY = "Unknown";
    public static final String UNKNOWN_LEVEL = "unknown";
    public static final String NO_DATA = "-";

    static final String FIELD_ORIGIN = "org";
    static final String FIELD_DESTINATION = "dest";
    static final String FIELD_DAYS = "days";
    static final String FIELD_VISITING_CITY_NUMBER = "visiting_city_number";
    static final String FIELD_DATE = "date";
    static final String FIELD_PEOPLE_NUMBER = "people_number";
    static final String FIELD_LOCAL_CONSTRAINT = "local_constraint";
    static final String FIELD_BUDGET = "budget";
    static final String FIELD_QUERY = "query";
    static final String FIELD_LEVEL = "level";
    static final String FIELD_ANNOTATED_PLAN = "annotated_plan";
    static final String FIELD_REFERENCE_INFORMATION = "reference_information";

    private static final String DAY_INDEX = "days";
    private static final String CURRENT_CITY = "current_city";
    private static final String REFERENCE_DESCRIPTION = "Description";
    private static final String REFERENCE_CONTENT = "Content";

    private final LiteralStructureDecoder decoder;
    private final ObjectMapper objectMapper;

    public NormalizedTrip normalize(Map<String, Object> record) {
        List<String> issues = new ArrayList<>();

        String annotatedPlan = rawPayload(record, FIELD_ANNOTATED_PLAN, issues);
        String referenceInformation = rawPayload(record, FIELD_REFERENCE_INFORMATION, issues);

        NormalizedTrip trip = NormalizedTrip.builder()
                .origin(cityName(record, FIELD_ORIGIN))
                .destination(cityName(record, FIELD_DESTINATION))
                .days(intField(record, FIELD_DAYS, issues))
                .visitingCityNumber(intField(record, FIELD_VISITING_CITY_NUMBER, issues))
                .date(rawPayloadOrDefault(record, FIELD_DATE, "[]", issues))
                .peopleNumber(intField(record, FIELD_PEOPLE_NUMBER, issues))
                .localConstraint(rawPayloadOrDefault(record, FIELD_LOCAL_CONSTRAINT, "{}", issues))
                .budget(doubleField(record, FIELD_BUDGET, issues))
                .query(textField(record, FIELD_QUERY, ""))
                .level(textField(record, FIELD_LEVEL, UNKNOWN_LEVEL))
                .rawAnnotatedPlan(annotatedPlan)
                .rawReferenceInformation(referenceInformation)
                .dayPlans(decodeDayPlans(record.get(FIELD_ANNOTATED_PLAN), annotatedPlan, issues))
                .references(decodeReferences(record.get(FIELD_REFERENCE_INFORMATION), referenceInformation, issues))
                .issues(issues)
                .build();

        if (trip.isMalformed()) {
            log.debug("Normalized record {} -> {} with issues: {}", trip.getOrigin(), trip.getDestination(), issues);
        }
        return trip;
    }

    /**
     * True for an activity or city value that carries data: non-blank and not the "-" sentinel
     */
    public static boolean isPresent(String value) {
        if (value == null) {
            return false;
        }
        String trimmed = value.trim();
        return !trimmed.isEmpty() && !NO_DATA.equals(trimmed);
    }

    // ==================== NESTED PAYLOADS ====================

    private List<NormalizedDayPlan> decodeDayPlans(Object rawValue, String rawText, List<String> issues) {
        List<NormalizedDayPlan> dayPlans = new ArrayList<>();
        Optional<JsonNode> decoded = decodePayload(rawValue, rawText);
        if (decoded.isEmpty() || !decoded.get().isArray()) {
            issues.add(FIELD_ANNOTATED_PLAN + " is not a decodable list");
            return dayPlans;
        }
        for (JsonNode entry : decoded.get()) {
            if (!entry.isObject() || entry.isEmpty()) {
                continue;
            }
            dayPlans.add(toDayPlan(entry));
        }
        return dayPlans;
    }

    private NormalizedDayPlan toDayPlan(JsonNode entry) {
        Map<ActivitySlot, String> activities = new EnumMap<>(ActivitySlot.class);
        for (ActivitySlot slot : ActivitySlot.values()) {
            String value = nodeText(entry.get(slot.getFieldName()));
            if (isPresent(value)) {
                activities.put(slot, value);
            }
        }
        String currentCity = nodeText(entry.get(CURRENT_CITY));
        return NormalizedDayPlan.builder()
                .dayIndex(dayIndex(entry.get(DAY_INDEX)))
                .currentCity(currentCity != null ? currentCity : "")
                .activities(activities)
                .build();
    }

    private List<NormalizedReference> decodeReferences(Object rawValue, String rawText, List<String> issues) {
        List<NormalizedReference> references = new ArrayList<>();
        Optional<JsonNode> decoded = decodePayload(rawValue, rawText);
        if (decoded.isEmpty() || !decoded.get().isArray()) {
            issues.add(FIELD_REFERENCE_INFORMATION + " is not a decodable list");
            return references;
        }
        for (JsonNode entry : decoded.get()) {
            if (entry.isObject() && entry.has(REFERENCE_DESCRIPTION) && entry.has(REFERENCE_CONTENT)) {
                references.add(NormalizedReference.builder()
                        .description(nullToEmpty(nodeText(entry.get(REFERENCE_DESCRIPTION))))
                        .content(nullToEmpty(nodeText(entry.get(REFERENCE_CONTENT))))
                        .build());
            }
        }
        return references;
    }

    /**
     * Sources that already deliver lists (JSON Lines with native arrays) skip text decoding
     */
    private Optional<JsonNode> decodePayload(Object rawValue, String rawText) {
        if (rawValue instanceof Collection || rawValue instanceof Map) {
            return Optional.of(objectMapper.valueToTree(rawValue));
        }
        return decoder.decode(rawText);
    }

    private Integer dayIndex(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isIntegralNumber() && node.canConvertToInt()) {
            return node.intValue();
        }
        if (node.isNumber()) {
            return (int) node.doubleValue();
        }
        Double parsed = parseNumber(node.asText());
        return parsed != null ? parsed.intValue() : null;
    }

    private String nodeText(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        return node.isValueNode() ? node.asText() : node.toString();
    }

    // ==================== SCALARS ====================

    private String cityName(Map<String, Object> record, String field) {
        Object value = record.get(field);
        if (value == null || value.toString().isBlank()) {
            return UNKNOWN_CITY;
        }
        return value.toString();
    }

    private String textField(Map<String, Object> record, String field, String defaultValue) {
        Object value = record.get(field);
        return value != null ? value.toString() : defaultValue;
    }

    private int intField(Map<String, Object> record, String field, List<String> issues) {
        Double value = numericField(record, field, issues);
        return value != null ? value.intValue() : 0;
    }

    private double doubleField(Map<String, Object> record, String field, List<String> issues) {
        Double value = numericField(record, field, issues);
        return value != null ? value : 0.0;
    }

    private Double numericField(Map<String, Object> record, String field, List<String> issues) {
        Object value = record.get(field);
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        Double parsed = parseNumber(value.toString());
        if (parsed == null) {
            issues.add(field + " is not numeric: '" + value + "'");
        }
        return parsed;
    }

    private Double parseNumber(String text) {
        if (text == null) {
            return null;
        }
        String cleaned = text.trim().replace(",", "").replace("$", "");
        if (cleaned.isEmpty()) {
            return null;
        }
        try {
            return Double.parseDouble(cleaned);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private String rawPayload(Map<String, Object> record, String field, List<String> issues) {
        return rawPayloadOrDefault(record, field, "[]", issues);
    }

    /**
     * Raw text of a field that is normally string-encoded; structured values are re-serialized as JSON
     */
    private String rawPayloadOrDefault(Map<String, Object> record, String field, String defaultValue,
                                       List<String> issues) {
        Object value = record.get(field);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof String) {
            return (String) value;
        }
        if (value instanceof Collection || value instanceof Map) {
            try {
                return objectMapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                issues.add(field + " could not be serialized: " + e.getOriginalMessage());
                return defaultValue;
            }
        }
        return value.toString();
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
