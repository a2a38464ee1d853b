package com.aigreentick.services.groupcast.campaign.model;

import java.time.Instant;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionRecord {
    private Instant datetime;
    private int sent;
    private int failed;
}
