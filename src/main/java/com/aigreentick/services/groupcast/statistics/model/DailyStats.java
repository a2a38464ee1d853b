package com.aigreentick.services.groupcast.statistics.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DailyStats {
    private long sent;
    private long failed;
    private int groups;
}
