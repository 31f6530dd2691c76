package com.sentinel.backend.modules.stats.presentation;

import com.sentinel.backend.modules.stats.application.StatisticsService;
import com.sentinel.backend.modules.stats.presentation.dto.StatisticsResponse;

import io.swagger.v3.oas.annotations.Operation;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatisticsController {

    private final StatisticsService statisticsService;

    public StatisticsController(StatisticsService statisticsService) {
        this.statisticsService = statisticsService;
    }

    @Operation(summary = "System totals")
    @GetMapping("/api/stats")
    public ResponseEntity<StatisticsResponse> stats() {
        return ResponseEntity.ok(statisticsService.collect());
    }
}
