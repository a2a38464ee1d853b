package com.aigreentick.services.groupcast.campaign.scheduling;

import java.time.Instant;
import java.time.ZoneId;

/**
 * Clock/timer seam: everything time-driven (campaign triggers, reconnect timers,
 * delayed refreshes) is scheduled through here.
 */
public interface TriggerService {

    TriggerHandle scheduleAt(Instant fireAt, Runnable task);

    /**
     * @param cronExpression six-field cron (second minute hour day-of-month month day-of-week)
     */
    TriggerHandle scheduleRecurring(String cronExpression, ZoneId zone, Runnable task);
}
