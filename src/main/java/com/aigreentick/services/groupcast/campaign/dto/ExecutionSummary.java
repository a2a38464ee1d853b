package com.aigreentick.services.groupcast.campaign.dto;

import java.time.Instant;
import java.util.List;

/**
 * Result of one campaign run.
 *
 * @param skipped true when nothing was attempted (campaign inactive, missing, or no session)
 */
public record ExecutionSummary(
        String campaignId,
        Instant startedAt,
        boolean skipped,
        int sent,
        int failed,
        List<DeliveryResult> deliveries) {

    public static ExecutionSummary skipped(String campaignId, Instant at) {
        return new ExecutionSummary(campaignId, at, true, 0, 0, List.of());
    }
}
