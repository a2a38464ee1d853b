package com.aigreentick.services.groupcast.support;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

import com.aigreentick.services.groupcast.campaign.scheduling.TriggerHandle;
import com.aigreentick.services.groupcast.campaign.scheduling.TriggerService;

/**
 * Records scheduled triggers; tests fire them explicitly.
 */
public class ManualTriggerService implements TriggerService {

    private final List<ScheduledTrigger> triggers = new ArrayList<>();

    @Override
    public synchronized TriggerHandle scheduleAt(Instant fireAt, Runnable task) {
        ScheduledTrigger trigger = new ScheduledTrigger(fireAt, null, null, task);
        triggers.add(trigger);
        return trigger;
    }

    @Override
    public synchronized TriggerHandle scheduleRecurring(String cronExpression, ZoneId zone, Runnable task) {
        ScheduledTrigger trigger = new ScheduledTrigger(null, cronExpression, zone, task);
        triggers.add(trigger);
        return trigger;
    }

    public synchronized List<ScheduledTrigger> pending() {
        return triggers.stream().filter(t -> !t.isCancelled()).toList();
    }

    public synchronized List<ScheduledTrigger> all() {
        return List.copyOf(triggers);
    }

    /**
     * Runs every pending one-shot trigger once and removes it.
     *
     * @return number fired
     */
    public int fireOneShots() {
        List<ScheduledTrigger> due;
        synchronized (this) {
            due = triggers.stream().filter(t -> !t.isCancelled() && t.fireAt() != null).toList();
            triggers.removeAll(due);
        }
        due.forEach(t -> t.task().run());
        return due.size();
    }

    public static final class ScheduledTrigger implements TriggerHandle {

        private final Instant fireAt;
        private final String cronExpression;
        private final ZoneId zone;
        private final Runnable task;
        private volatile boolean cancelled;

        ScheduledTrigger(Instant fireAt, String cronExpression, ZoneId zone, Runnable task) {
            this.fireAt = fireAt;
            this.cronExpression = cronExpression;
            this.zone = zone;
            this.task = task;
        }

        public Instant fireAt() {
            return fireAt;
        }

        public String cronExpression() {
            return cronExpression;
        }

        public ZoneId zone() {
            return zone;
        }

        public Runnable task() {
            return task;
        }

        public void fire() {
            task.run();
        }

        @Override
        public void cancel() {
            cancelled = true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }
    }
}
