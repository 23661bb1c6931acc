package com.travel.tripgraph.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TripInsights {

    public enum BudgetTier { LOW, MEDIUM, HIGH }

    private BudgetTier budgetTier;
    private String budgetAdvice;
    private String tripLengthAdvice;
}
