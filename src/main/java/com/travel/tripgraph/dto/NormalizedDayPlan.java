package com.travel.tripgraph.dto;

import com.travel.tripgraph.graph.node.ActivitySlot;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NormalizedDayPlan {

    private Integer dayIndex; // null when the entry has no usable "days" value
    private String currentCity;

    /**
     * Present activity fields only, in slot order
     */
    @Builder.Default
    private Map<ActivitySlot, String> activities = new EnumMap<>(ActivitySlot.class);
}
