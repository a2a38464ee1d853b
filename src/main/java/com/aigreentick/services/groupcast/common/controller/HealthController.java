package com.aigreentick.services.groupcast.common.controller;

import java.lang.management.ManagementFactory;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import com.aigreentick.services.groupcast.campaign.service.CampaignScheduler;
import com.aigreentick.services.groupcast.connection.service.ConnectionManager;

import lombok.RequiredArgsConstructor;

@RestController
@RequiredArgsConstructor
public class HealthController {

    private final ConnectionManager connectionManager;
    private final CampaignScheduler campaignScheduler;
    private final Clock clock;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("timestamp", Instant.now(clock).toString());
        body.put("uptimeSeconds", ManagementFactory.getRuntimeMXBean().getUptime() / 1000);
        body.put("connection", connectionManager.getState().getValue());
        body.put("armedCampaigns", campaignScheduler.armedCount());
        return ResponseEntity.ok(body);
    }
}
