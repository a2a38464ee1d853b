package com.aigreentick.services.groupcast.campaign.scheduling;

import java.time.Instant;
import java.time.ZoneId;
import java.util.concurrent.ScheduledFuture;

import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Service;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class SpringTriggerService implements TriggerService {

    private final TaskScheduler taskScheduler;

    @Override
    public TriggerHandle scheduleAt(Instant fireAt, Runnable task) {
        return new FutureHandle(taskScheduler.schedule(task, fireAt));
    }

    @Override
    public TriggerHandle scheduleRecurring(String cronExpression, ZoneId zone, Runnable task) {
        return new FutureHandle(taskScheduler.schedule(task, new CronTrigger(cronExpression, zone)));
    }

    private record FutureHandle(ScheduledFuture<?> future) implements TriggerHandle {

        @Override
        public void cancel() {
            // never interrupt: an execution already started runs to completion
            future.cancel(false);
        }

        @Override
        public boolean isCancelled() {
            return future.isCancelled();
        }
    }
}
