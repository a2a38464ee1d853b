package com.aigreentick.services.groupcast.statistics.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.aigreentick.services.groupcast.statistics.model.Statistics;
import com.aigreentick.services.groupcast.statistics.service.StatisticsTracker;

import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/statistics")
@RequiredArgsConstructor
public class StatisticsController {

    private final StatisticsTracker statisticsTracker;

    @GetMapping
    public ResponseEntity<Statistics> getStatistics() {
        return ResponseEntity.ok(statisticsTracker.snapshot());
    }
}
