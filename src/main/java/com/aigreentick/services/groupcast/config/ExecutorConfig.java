package com.aigreentick.services.groupcast.config;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import lombok.extern.slf4j.Slf4j;

@Configuration
@EnableScheduling
@Slf4j
public class ExecutorConfig {

    @Value("${groupcast.campaigns.max-concurrent-executions:3}")
    private int maxConcurrentExecutions;

    @Value("${groupcast.campaigns.execution-queue-capacity:100}")
    private int executionQueueCapacity;

    @Value("${groupcast.scheduler.pool-size:2}")
    private int schedulerPoolSize;

    private final AtomicLong rejectedExecutions = new AtomicLong(0);

    /**
     * Runs campaign executions. Each run is a long, paced loop, so the pool is
     * small and bounded; distinct campaigns run in parallel up to the pool size.
     */
    @Bean(name = "campaignExecutor", destroyMethod = "shutdown")
    public ExecutorService campaignExecutor() {
        log.info("Initializing campaignExecutor:");
        log.info("  - Pool size: {} threads", maxConcurrentExecutions);
        log.info("  - Queue capacity: {} runs", executionQueueCapacity);

        return new ThreadPoolExecutor(
                maxConcurrentExecutions,
                maxConcurrentExecutions,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(executionQueueCapacity),
                r -> {
                    Thread t = new Thread(r);
                    t.setName("campaign-" + t.getId());
                    t.setDaemon(false);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy() {
                    @Override
                    public void rejectedExecution(Runnable r, ThreadPoolExecutor e) {
                        long total = rejectedExecutions.incrementAndGet();
                        log.warn("Campaign executor queue full! Rejected run #{}. Queue: {}/{}, Active: {}/{}",
                                total, e.getQueue().size(), executionQueueCapacity,
                                e.getActiveCount(), e.getMaximumPoolSize());
                        super.rejectedExecution(r, e);
                    }
                });
    }

    /**
     * Single consumer for session state events, so transitions are applied in order.
     */
    @Bean(name = "connectionEventExecutor", destroyMethod = "shutdownNow")
    public ExecutorService connectionEventExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("connection-events");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Backs campaign triggers, reconnect timers and {@code @Scheduled} maintenance.
     */
    @Bean(name = "taskScheduler", destroyMethod = "shutdown")
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(schedulerPoolSize);
        scheduler.setThreadNamePrefix("trigger-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setErrorHandler(t -> log.error("Scheduled task failed", t));
        scheduler.initialize();
        return scheduler;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    public long getRejectedExecutions() {
        return rejectedExecutions.get();
    }
}
