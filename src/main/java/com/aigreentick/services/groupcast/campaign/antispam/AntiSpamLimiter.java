package com.aigreentick.services.groupcast.campaign.antispam;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.aigreentick.services.groupcast.config.GroupcastProperties;
import com.aigreentick.services.groupcast.settings.model.Settings;
import com.aigreentick.services.groupcast.settings.service.SettingsService;

import lombok.extern.slf4j.Slf4j;

/**
 * Per-destination fixed-window send limiter.
 * <p>
 * The window opens at the first counted send and resets once it has fully elapsed.
 * Check and increment happen in one atomic map update, so concurrent executions
 * can never push a destination past its cap. Settings are read on every check.
 */
@Slf4j
@Component
public class AntiSpamLimiter {

    private final Map<String, AntiSpamEntry> entries = new ConcurrentHashMap<>();
    private final SettingsService settingsService;
    private final Duration staleAfter;
    private final Clock clock;

    public AntiSpamLimiter(SettingsService settingsService, GroupcastProperties properties, Clock clock) {
        this.settingsService = settingsService;
        this.staleAfter = properties.getAntiSpam().getStaleAfter();
        this.clock = clock;
    }

    /**
     * Decides whether one more send to {@code destinationId} is allowed and, if so, counts it.
     * Fails open: if the limits cannot be evaluated the send is allowed.
     */
    public boolean tryAcquire(String destinationId) {
        try {
            Settings.AntiSpam limits = settingsService.current().getAntiSpam();
            if (limits == null || !limits.isEnabled()) {
                return true;
            }

            Duration window = Duration.ofMinutes(limits.getIntervalMinutes());
            int max = limits.getMaxMessagesPerGroup();
            Instant now = clock.instant();
            boolean[] allowed = new boolean[1];

            entries.compute(destinationId, (id, entry) -> {
                if (entry == null || Duration.between(entry.windowStart(), now).compareTo(window) > 0) {
                    allowed[0] = true;
                    return new AntiSpamEntry(1, now);
                }
                if (entry.count() >= max) {
                    allowed[0] = false;
                    return entry;
                }
                allowed[0] = true;
                return entry.increment();
            });

            if (!allowed[0]) {
                log.warn("Anti-spam limit reached for group {} ({} messages per {} min)",
                        destinationId, max, limits.getIntervalMinutes());
            }
            return allowed[0];
        } catch (Exception e) {
            log.error("Anti-spam check failed for group {}, allowing send", destinationId, e);
            return true;
        }
    }

    /**
     * Drops entries whose window opened longer ago than the stale threshold.
     *
     * @return number of entries removed
     */
    @Scheduled(fixedRateString = "${groupcast.anti-spam.cleanup-interval:PT30M}",
            initialDelayString = "${groupcast.anti-spam.cleanup-interval:PT30M}")
    public int cleanup() {
        Instant cutoff = clock.instant().minus(staleAfter);
        int before = entries.size();
        entries.values().removeIf(entry -> entry.windowStart().isBefore(cutoff));
        int removed = before - entries.size();
        if (removed > 0) {
            log.info("Anti-spam cleanup removed {} stale entries", removed);
        }
        return removed;
    }

    int trackedDestinations() {
        return entries.size();
    }
}
