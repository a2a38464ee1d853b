package com.aigreentick.services.groupcast.statistics.service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.TreeMap;

import org.springframework.stereotype.Service;

import com.aigreentick.services.groupcast.config.GroupcastProperties;
import com.aigreentick.services.groupcast.statistics.enums.StatKind;
import com.aigreentick.services.groupcast.statistics.model.DailyStats;
import com.aigreentick.services.groupcast.statistics.model.Statistics;
import com.aigreentick.services.groupcast.store.enums.CollectionName;
import com.aigreentick.services.groupcast.store.service.PersistenceGateway;
import com.fasterxml.jackson.core.type.TypeReference;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Aggregates send outcomes into lifetime and per-day counters.
 * Every update is a read-modify-write of the whole statistics document, serialized here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StatisticsTracker {

    private static final TypeReference<Statistics> STATISTICS_TYPE = new TypeReference<>() {
    };

    private final PersistenceGateway persistenceGateway;
    private final GroupcastProperties properties;
    private final Clock clock;

    public synchronized void record(StatKind kind, int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative: " + count);
        }
        try {
            Statistics stats = load();
            String today = LocalDate.now(clock.withZone(properties.zoneId())).toString();
            DailyStats day = stats.getDailyStats().computeIfAbsent(today, k -> new DailyStats());

            switch (kind) {
                case SENT -> {
                    stats.setTotalSent(stats.getTotalSent() + count);
                    day.setSent(day.getSent() + count);
                }
                case FAILED -> {
                    stats.setTotalFailed(stats.getTotalFailed() + count);
                    day.setFailed(day.getFailed() + count);
                }
                case GROUPS -> {
                    stats.setTotalGroups(count);
                    day.setGroups(count);
                }
            }

            save(stats);
        } catch (Exception e) {
            log.error("Failed to update statistics. kind={} count={}", kind, count, e);
        }
    }

    public synchronized void recordCampaignCreated() {
        try {
            Statistics stats = load();
            stats.setCampaignsCreated(stats.getCampaignsCreated() + 1);
            save(stats);
        } catch (Exception e) {
            log.error("Failed to record campaign creation", e);
        }
    }

    public synchronized Statistics snapshot() {
        return load();
    }

    private Statistics load() {
        Statistics stats = persistenceGateway.read(CollectionName.STATISTICS, STATISTICS_TYPE)
                .orElseGet(Statistics::empty);
        if (stats.getDailyStats() == null) {
            stats.setDailyStats(new TreeMap<>());
        }
        return stats;
    }

    private void save(Statistics stats) {
        if (!persistenceGateway.write(CollectionName.STATISTICS, stats)) {
            log.warn("Statistics update was not persisted");
        }
    }
}
