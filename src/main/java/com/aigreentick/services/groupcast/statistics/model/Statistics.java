package com.aigreentick.services.groupcast.statistics.model;

import java.util.Map;
import java.util.TreeMap;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Statistics {

    private long totalSent;
    private long totalFailed;
    private int totalGroups;
    private long campaignsCreated;

    // ISO date (yyyy-MM-dd) -> counters for that calendar day
    @Builder.Default
    private Map<String, DailyStats> dailyStats = new TreeMap<>();

    public static Statistics empty() {
        return Statistics.builder().build();
    }
}
