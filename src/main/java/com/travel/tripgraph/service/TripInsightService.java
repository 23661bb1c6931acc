package com.travel.tripgraph.service;

import com.travel.tripgraph.dto.TripInsights;
import com.travel.tripgraph.dto.TripInsights.BudgetTier;
import org.springframework.stereotype.Service;

/**
 * Rule-based planning hints derived from a requested budget and trip length
 */
@Service
public class TripInsightService {

    static final double LOW_BUDGET_CEILING = 500;
    static final double MEDIUM_BUDGET_CEILING = 1500;

    public BudgetTier classifyBudget(double budget) {
        if (budget < LOW_BUDGET_CEILING) {
            return BudgetTier.LOW;
        }
        if (budget <= MEDIUM_BUDGET_CEILING) {
            return BudgetTier.MEDIUM;
        }
        return BudgetTier.HIGH;
    }

    public String budgetAdvice(BudgetTier tier) {
        switch (tier) {
            case LOW:
                return "Stay in hostels or budget Airbnbs and use public transport.";
            case MEDIUM:
                return "Use 3-star hotels and eat at mid-range restaurants.";
            default:
                return "Go for 4-star hotels, guided tours, and premium transport.";
        }
    }

    public String tripLengthAdvice(Integer days) {
        if (days == null || days <= 0) {
            return "Trip length not mentioned.";
        }
        if (days <= 2) {
            return "Short trip: focus on 1-2 major attractions.";
        }
        if (days <= 5) {
            return "Medium trip: include sightseeing, food, and leisure time.";
        }
        return "Long trip: plan multiple cities or themed days.";
    }

    /**
     * @return null when neither a budget nor a trip length was given
     */
    public TripInsights insights(Double budget, Integer days) {
        if (budget == null && days == null) {
            return null;
        }
        TripInsights.TripInsightsBuilder insights = TripInsights.builder()
                .tripLengthAdvice(tripLengthAdvice(days));
        if (budget != null) {
            BudgetTier tier = classifyBudget(budget);
            insights.budgetTier(tier).budgetAdvice(budgetAdvice(tier));
        }
        return insights.build();
    }
}
