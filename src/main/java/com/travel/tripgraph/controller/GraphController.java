package com.travel.tripgraph.controller;

import com.travel.tripgraph.graph.repository.CityNodeRepository;
import com.travel.tripgraph.service.GraphStatsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/graph")
@RequiredArgsConstructor
@Tag(name = "Graph", description = "Knowledge graph inspection")
public class GraphController {

    private final GraphStatsService graphStatsService;
    private final CityNodeRepository cityNodeRepository;

    @Operation(summary = "Node counts per label")
    @GetMapping("/stats")
    public Map<String, Long> stats() {
        return graphStatsService.nodeCounts();
    }

    @Operation(summary = "All city names in the graph")
    @GetMapping("/cities")
    public List<String> cities() {
        return cityNodeRepository.findAllNames();
    }
}
