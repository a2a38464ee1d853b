package com.aigreentick.services.groupcast.campaign.scheduling;

import java.time.Instant;
import java.time.ZoneId;

/**
 * Concrete trigger produced from a schedule descriptor.
 *
 * @param cronExpression six-field cron; for one-shot triggers it pins minute/hour/day/month
 *                       and would recur yearly, so one-shots are scheduled by {@code fireAt}
 * @param fireAt         absolute fire time, set for one-shot triggers only
 */
public record TriggerSpec(boolean oneShot, String cronExpression, Instant fireAt, ZoneId zone) {

    public static TriggerSpec oneShot(Instant fireAt, String cronExpression, ZoneId zone) {
        return new TriggerSpec(true, cronExpression, fireAt, zone);
    }

    public static TriggerSpec recurring(String cronExpression, ZoneId zone) {
        return new TriggerSpec(false, cronExpression, null, zone);
    }
}
