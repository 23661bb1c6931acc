package com.travel.tripgraph.service;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LiteralStructureDecoderTest {

    private LiteralStructureDecoder decoder;

    @BeforeEach
    void setUp() {
        decoder = new LiteralStructureDecoder();
    }

    @Test
    void testDecodeDayPlanLiteral() {
        String text = "[{'days': 1, 'current_city': 'from New York to Chicago', "
                + "'transportation': 'Flight Number: F123', 'breakfast': '-', 'lunch': 'Cafe X, Chicago'}, {}]";

        Optional<JsonNode> result = decoder.decode(text);

        assertTrue(result.isPresent());
        JsonNode list = result.get();
        assertTrue(list.isArray());
        assertEquals(2, list.size());
        assertEquals(1, list.get(0).get("days").asInt());
        assertEquals("from New York to Chicago", list.get(0).get("current_city").asText());
        assertEquals("-", list.get(0).get("breakfast").asText());
        assertTrue(list.get(1).isEmpty());
    }

    @Test
    void testDecodePythonConstants() {
        JsonNode node = decoder.decode("{'a': True, 'b': False, 'c': None}").orElseThrow();

        assertTrue(node.get("a").booleanValue());
        assertFalse(node.get("b").booleanValue());
        assertTrue(node.get("c").isNull());
    }

    @Test
    void testDecodePlainJson() {
        JsonNode node = decoder.decode("[{\"Description\": \"Flights\", \"Content\": \"F1\"}]").orElseThrow();

        assertEquals("Flights", node.get(0).get("Description").asText());
    }

    @Test
    void testDecodeEscapesAndMixedQuotes() {
        JsonNode node = decoder.decode("['it\\'s', \"Joe's Diner\", 'caf\\xe9', 'line\\nbreak']").orElseThrow();

        assertEquals("it's", node.get(0).asText());
        assertEquals("Joe's Diner", node.get(1).asText());
        assertEquals("café", node.get(2).asText());
        assertEquals("line\nbreak", node.get(3).asText());
    }

    @Test
    void testDecodeTuplesAndSetsAsArrays() {
        JsonNode tuple = decoder.decode("(1, 2.5, 'x')").orElseThrow();
        JsonNode set = decoder.decode("{'a', 'b'}").orElseThrow();

        assertTrue(tuple.isArray());
        assertEquals(3, tuple.size());
        assertEquals(2.5, tuple.get(1).doubleValue());
        assertTrue(set.isArray());
        assertEquals(2, set.size());
    }

    @Test
    void testTrailingCommaAccepted() {
        JsonNode node = decoder.decode("[1, 2, ]").orElseThrow();

        assertEquals(2, node.size());
    }

    @Test
    void testMalformedInputReturnsEmpty() {
        assertTrue(decoder.decode("[{'days': 1,").isEmpty());
        assertTrue(decoder.decode("not a literal").isEmpty());
        assertTrue(decoder.decode("[1, 2] extra").isEmpty());
        assertTrue(decoder.decode("'unterminated").isEmpty());
    }

    @Test
    void testBlankInputReturnsEmpty() {
        assertTrue(decoder.decode(null).isEmpty());
        assertTrue(decoder.decode("   ").isEmpty());
    }

    @Test
    void testExcessiveNestingReturnsEmpty() {
        String deep = "[".repeat(300) + "]".repeat(300);

        assertTrue(decoder.decode(deep).isEmpty());
    }
}
