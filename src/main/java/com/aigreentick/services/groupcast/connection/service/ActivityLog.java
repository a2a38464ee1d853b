package com.aigreentick.services.groupcast.connection.service;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import org.springframework.stereotype.Component;

import com.aigreentick.services.groupcast.config.GroupcastProperties;
import com.aigreentick.services.groupcast.connection.dto.ActivityEntry;

import lombok.extern.slf4j.Slf4j;

/**
 * Operator-visible log of connection transitions and campaign activity.
 * Bounded, newest first; the oldest entry is dropped on overflow.
 */
@Slf4j
@Component
public class ActivityLog {

    private final Deque<ActivityEntry> entries = new ArrayDeque<>();
    private final int capacity;
    private final Clock clock;

    public ActivityLog(GroupcastProperties properties, Clock clock) {
        this.capacity = properties.getConnection().getLogCapacity();
        this.clock = clock;
    }

    public void add(String message) {
        log.info(message);
        synchronized (entries) {
            entries.addFirst(new ActivityEntry(clock.instant(), message));
            while (entries.size() > capacity) {
                entries.removeLast();
            }
        }
    }

    public List<ActivityEntry> latest(int limit) {
        synchronized (entries) {
            return entries.stream().limit(limit).toList();
        }
    }

    public List<ActivityEntry> all() {
        synchronized (entries) {
            return List.copyOf(entries);
        }
    }
}
