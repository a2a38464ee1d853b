package com.aigreentick.services.groupcast.campaign.service;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import com.aigreentick.services.groupcast.campaign.enums.ScheduleType;
import com.aigreentick.services.groupcast.campaign.model.Campaign;
import com.aigreentick.services.groupcast.campaign.repository.CampaignStore;
import com.aigreentick.services.groupcast.campaign.scheduling.ScheduleTranslator;
import com.aigreentick.services.groupcast.campaign.scheduling.ScheduleValidationException;
import com.aigreentick.services.groupcast.campaign.scheduling.TriggerHandle;
import com.aigreentick.services.groupcast.campaign.scheduling.TriggerService;
import com.aigreentick.services.groupcast.campaign.scheduling.TriggerSpec;
import com.aigreentick.services.groupcast.connection.enums.ConnectionState;
import com.aigreentick.services.groupcast.connection.event.ConnectionStateChangedEvent;
import com.aigreentick.services.groupcast.connection.service.ActivityLog;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

/**
 * Registry of armed campaign triggers, at most one per campaign.
 * <p>
 * A firing trigger hands the run to the campaign executor and returns at once.
 * The run reloads the campaign, so edits made after arming are honoured.
 * Immediate campaigns are armed only when created; re-arming skips them.
 */
@Slf4j
@Service
public class CampaignScheduler {

    private final Map<String, TriggerHandle> armed = new HashMap<>();

    private final ScheduleTranslator scheduleTranslator;
    private final TriggerService triggerService;
    private final CampaignStore campaignStore;
    private final ExecutionEngine executionEngine;
    private final ActivityLog activityLog;
    private final ExecutorService campaignExecutor;

    public CampaignScheduler(
            ScheduleTranslator scheduleTranslator,
            TriggerService triggerService,
            CampaignStore campaignStore,
            ExecutionEngine executionEngine,
            ActivityLog activityLog,
            @Qualifier("campaignExecutor") ExecutorService campaignExecutor) {
        this.scheduleTranslator = scheduleTranslator;
        this.triggerService = triggerService;
        this.campaignStore = campaignStore;
        this.executionEngine = executionEngine;
        this.activityLog = activityLog;
        this.campaignExecutor = campaignExecutor;
    }

    /**
     * Arms a newly created campaign, immediate schedules included.
     *
     * @return true if a trigger is now armed
     */
    public boolean arm(Campaign campaign) {
        return arm(campaign, true);
    }

    /**
     * Replaces the campaign's trigger after an edit or a reconnect.
     * Immediate campaigns are disarmed and not re-fired.
     */
    public boolean rearm(Campaign campaign) {
        return arm(campaign, false);
    }

    private synchronized boolean arm(Campaign campaign, boolean includeImmediate) {
        disarm(campaign.getId());

        if (!campaign.isActive()) {
            log.debug("Campaign {} is paused, not arming", campaign.getId());
            return false;
        }
        if (!includeImmediate && campaign.getSchedule() != null) {
            if (campaign.getSchedule().getType() == ScheduleType.IMMEDIATE) {
                return false;
            }
            // a one-time campaign that already had its moment stays as it is
            if (scheduleTranslator.hasElapsed(campaign.getSchedule())) {
                log.debug("Campaign {} one-time schedule has passed, not re-arming", campaign.getId());
                return false;
            }
        }

        TriggerSpec spec;
        try {
            spec = scheduleTranslator.translate(campaign.getSchedule());
        } catch (ScheduleValidationException e) {
            log.warn("Campaign {} not scheduled: {}", campaign.getId(), e.getMessage());
            activityLog.add("Campaign \"" + campaign.getName() + "\" not scheduled: " + e.getMessage());
            return false;
        }

        String campaignId = campaign.getId();
        TriggerHandle handle;
        if (spec.oneShot()) {
            AtomicReference<TriggerHandle> self = new AtomicReference<>();
            handle = triggerService.scheduleAt(spec.fireAt(), () -> {
                releaseOneShot(campaignId, self);
                fire(campaignId);
            });
            self.set(handle);
            log.info("Campaign {} armed for {}", campaignId, spec.fireAt());
        } else {
            handle = triggerService.scheduleRecurring(spec.cronExpression(), spec.zone(), () -> fire(campaignId));
            log.info("Campaign {} armed with cron '{}' ({})", campaignId, spec.cronExpression(), spec.zone());
        }

        armed.put(campaignId, handle);
        return true;
    }

    public synchronized void disarm(String campaignId) {
        TriggerHandle handle = armed.remove(campaignId);
        if (handle != null) {
            handle.cancel();
            log.debug("Campaign {} disarmed", campaignId);
        }
    }

    /**
     * Re-arms every stored active campaign, skipping immediate ones.
     *
     * @return number of triggers armed
     */
    public int armAllActive() {
        int count = 0;
        for (Campaign campaign : campaignStore.findAll()) {
            try {
                if (rearm(campaign)) {
                    count++;
                }
            } catch (Exception e) {
                log.error("Failed to arm campaign {}", campaign.getId(), e);
            }
        }
        activityLog.add(count + " campaigns scheduled");
        return count;
    }

    public synchronized void disarmAll() {
        armed.values().forEach(TriggerHandle::cancel);
        int count = armed.size();
        armed.clear();
        if (count > 0) {
            log.info("Disarmed {} campaign triggers", count);
        }
    }

    public synchronized int armedCount() {
        return armed.size();
    }

    public synchronized boolean isArmed(String campaignId) {
        return armed.containsKey(campaignId);
    }

    // one-shot triggers leave the registry once fired; the campaign keeps its status.
    // The handle is read under the monitor, after arm() has stored it.
    private synchronized void releaseOneShot(String campaignId, AtomicReference<TriggerHandle> self) {
        TriggerHandle handle = self.get();
        if (handle != null) {
            armed.remove(campaignId, handle);
        }
    }

    private void fire(String campaignId) {
        try {
            campaignExecutor.execute(() -> run(campaignId));
        } catch (RejectedExecutionException e) {
            log.error("Run of campaign {} rejected, executor saturated", campaignId, e);
            activityLog.add("Campaign " + campaignId + " skipped: too many runs in progress");
        }
    }

    private void run(String campaignId) {
        try {
            Optional<Campaign> campaign = campaignStore.findById(campaignId);
            if (campaign.isEmpty()) {
                log.warn("Campaign {} no longer exists, disarming", campaignId);
                disarm(campaignId);
                return;
            }
            executionEngine.execute(campaign.get());
        } catch (Exception e) {
            log.error("Campaign {} run failed", campaignId, e);
            activityLog.add("Campaign execution error: " + e.getMessage());
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        int count = armAllActive();
        log.info("Startup: {} campaigns armed", count);
    }

    @EventListener
    public void onConnectionStateChanged(ConnectionStateChangedEvent event) {
        if (event.current() == ConnectionState.CONNECTED) {
            armAllActive();
        } else if (event.current() == ConnectionState.DISCONNECTED && event.manual()) {
            disarmAll();
        }
    }

    @PreDestroy
    public void shutdown() {
        disarmAll();
    }
}
