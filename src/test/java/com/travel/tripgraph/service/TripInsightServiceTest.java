package com.travel.tripgraph.service;

import com.travel.tripgraph.dto.TripInsights;
import com.travel.tripgraph.dto.TripInsights.BudgetTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TripInsightServiceTest {

    private TripInsightService insightService;

    @BeforeEach
    void setUp() {
        insightService = new TripInsightService();
    }

    @Test
    void testBudgetTierBoundaries() {
        assertEquals(BudgetTier.LOW, insightService.classifyBudget(499.99));
        assertEquals(BudgetTier.MEDIUM, insightService.classifyBudget(500));
        assertEquals(BudgetTier.MEDIUM, insightService.classifyBudget(1500));
        assertEquals(BudgetTier.HIGH, insightService.classifyBudget(1500.01));
    }

    @Test
    void testTripLengthAdvice() {
        assertEquals("Trip length not mentioned.", insightService.tripLengthAdvice(null));
        assertEquals("Short trip: focus on 1-2 major attractions.", insightService.tripLengthAdvice(2));
        assertEquals("Medium trip: include sightseeing, food, and leisure time.", insightService.tripLengthAdvice(5));
        assertEquals("Long trip: plan multiple cities or themed days.", insightService.tripLengthAdvice(7));
    }

    @Test
    void testInsightsWithBudgetOnly() {
        TripInsights insights = insightService.insights(300.0, null);

        assertEquals(BudgetTier.LOW, insights.getBudgetTier());
        assertNotNull(insights.getBudgetAdvice());
        assertEquals("Trip length not mentioned.", insights.getTripLengthAdvice());
    }

    @Test
    void testNoInsightsWithoutInputs() {
        assertNull(insightService.insights(null, null));
    }
}
