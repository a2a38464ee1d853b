package com.aigreentick.services.groupcast.campaign.antispam;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.aigreentick.services.groupcast.config.GroupcastProperties;
import com.aigreentick.services.groupcast.settings.model.Settings;
import com.aigreentick.services.groupcast.settings.service.SettingsService;
import com.aigreentick.services.groupcast.store.service.PersistenceException;
import com.aigreentick.services.groupcast.support.InMemoryPersistenceGateway;
import com.aigreentick.services.groupcast.support.MutableClock;

class AntiSpamLimiterTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-10T12:00:00Z"), ZoneOffset.UTC);
    private final GroupcastProperties properties = new GroupcastProperties();
    private SettingsService settingsService;
    private AntiSpamLimiter limiter;

    @BeforeEach
    void setUp() {
        settingsService = new SettingsService(new InMemoryPersistenceGateway(), properties);
        limiter = new AntiSpamLimiter(settingsService, properties, clock);
    }

    private void limits(boolean enabled, int intervalMinutes, int max) {
        Settings settings = settingsService.defaults();
        settings.getAntiSpam().setEnabled(enabled);
        settings.getAntiSpam().setIntervalMinutes(intervalMinutes);
        settings.getAntiSpam().setMaxMessagesPerGroup(max);
        settingsService.update(settings);
    }

    @Test
    void allowsUpToMaxThenRejects() {
        limits(true, 30, 2);

        assertThat(limiter.tryAcquire("group-a")).isTrue();
        assertThat(limiter.tryAcquire("group-a")).isTrue();
        assertThat(limiter.tryAcquire("group-a")).isFalse();
        assertThat(limiter.tryAcquire("group-a")).isFalse();
    }

    @Test
    void countsEachDestinationSeparately() {
        limits(true, 30, 1);

        assertThat(limiter.tryAcquire("group-a")).isTrue();
        assertThat(limiter.tryAcquire("group-b")).isTrue();
        assertThat(limiter.tryAcquire("group-a")).isFalse();
    }

    @Test
    void windowResetsOnlyAfterItFullyElapsed() {
        limits(true, 30, 1);
        assertThat(limiter.tryAcquire("group-a")).isTrue();

        clock.advance(Duration.ofMinutes(30));
        assertThat(limiter.tryAcquire("group-a")).isFalse();

        clock.advance(Duration.ofSeconds(1));
        assertThat(limiter.tryAcquire("group-a")).isTrue();
        assertThat(limiter.tryAcquire("group-a")).isFalse();
    }

    @Test
    void rejectedAttemptsDoNotExtendTheWindow() {
        limits(true, 30, 1);
        limiter.tryAcquire("group-a");

        clock.advance(Duration.ofMinutes(20));
        assertThat(limiter.tryAcquire("group-a")).isFalse();

        clock.advance(Duration.ofMinutes(11));
        assertThat(limiter.tryAcquire("group-a")).isTrue();
    }

    @Test
    void disabledLimiterAllowsEverything() {
        limits(false, 30, 1);

        for (int i = 0; i < 5; i++) {
            assertThat(limiter.tryAcquire("group-a")).isTrue();
        }
        assertThat(limiter.trackedDestinations()).isZero();
    }

    @Test
    void failsOpenWhenSettingsCannotBeRead() {
        SettingsService broken = mock(SettingsService.class);
        when(broken.current()).thenThrow(new PersistenceException("disk gone", null));
        AntiSpamLimiter failing = new AntiSpamLimiter(broken, properties, clock);

        assertThat(failing.tryAcquire("group-a")).isTrue();
    }

    @Test
    void cleanupDropsOnlyStaleEntries() {
        limits(true, 30, 10);
        limiter.tryAcquire("old");
        clock.advance(Duration.ofMinutes(50));
        limiter.tryAcquire("recent");

        clock.advance(Duration.ofMinutes(15));

        assertThat(limiter.cleanup()).isEqualTo(1);
        assertThat(limiter.trackedDestinations()).isEqualTo(1);
    }

    @Test
    void concurrentRunsNeverExceedTheCap() throws Exception {
        limits(true, 30, 10);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Boolean>> attempts = new ArrayList<>();
            for (int i = 0; i < 50; i++) {
                attempts.add(() -> limiter.tryAcquire("group-a"));
            }

            int allowed = 0;
            for (Future<Boolean> result : pool.invokeAll(attempts)) {
                if (result.get()) {
                    allowed++;
                }
            }
            assertThat(allowed).isEqualTo(10);
        } finally {
            pool.shutdownNow();
        }
    }
}
