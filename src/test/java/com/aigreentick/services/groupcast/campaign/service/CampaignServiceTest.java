package com.aigreentick.services.groupcast.campaign.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.aigreentick.services.groupcast.campaign.dto.CampaignRequest;
import com.aigreentick.services.groupcast.campaign.enums.CampaignStatus;
import com.aigreentick.services.groupcast.campaign.model.Campaign;
import com.aigreentick.services.groupcast.campaign.model.ScheduleDescriptor;
import com.aigreentick.services.groupcast.campaign.repository.CampaignStore;
import com.aigreentick.services.groupcast.campaign.scheduling.ScheduleTranslator;
import com.aigreentick.services.groupcast.campaign.scheduling.ScheduleValidationException;
import com.aigreentick.services.groupcast.common.exception.InvalidRequestException;
import com.aigreentick.services.groupcast.common.exception.ResourceNotFoundException;
import com.aigreentick.services.groupcast.config.GroupcastProperties;
import com.aigreentick.services.groupcast.connection.service.ActivityLog;
import com.aigreentick.services.groupcast.statistics.service.StatisticsTracker;
import com.aigreentick.services.groupcast.support.InMemoryPersistenceGateway;
import com.aigreentick.services.groupcast.support.MutableClock;

class CampaignServiceTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-10T12:00:00Z"), ZoneOffset.UTC);
    private final GroupcastProperties properties = new GroupcastProperties();
    private final InMemoryPersistenceGateway gateway = new InMemoryPersistenceGateway();
    private final CampaignScheduler scheduler = mock(CampaignScheduler.class);

    private CampaignStore campaignStore;
    private StatisticsTracker statisticsTracker;
    private CampaignService service;

    @BeforeEach
    void setUp() {
        campaignStore = new CampaignStore(gateway);
        statisticsTracker = new StatisticsTracker(gateway, properties, clock);
        service = new CampaignService(
                campaignStore,
                scheduler,
                new ScheduleTranslator(clock, properties),
                statisticsTracker,
                new ActivityLog(properties, clock),
                properties,
                clock);
    }

    private static CampaignRequest request(List<String> groups) {
        return CampaignRequest.builder()
                .name(" Weekly promo ")
                .message("Hello everyone")
                .targetGroups(groups)
                .schedule(ScheduleDescriptor.daily("09:00"))
                .build();
    }

    @Test
    void createStoresArmsAndCounts() {
        Campaign campaign = service.create(request(List.of("g1", "g2")));

        assertThat(campaign.getId()).isNotBlank();
        assertThat(campaign.getName()).isEqualTo("Weekly promo");
        assertThat(campaign.getStatus()).isEqualTo(CampaignStatus.ACTIVE);
        assertThat(campaign.getStats().getTotalSent()).isZero();
        assertThat(campaign.getCreatedAt()).isEqualTo(clock.instant());
        assertThat(campaignStore.findAll()).hasSize(1);
        assertThat(statisticsTracker.snapshot().getCampaignsCreated()).isEqualTo(1);
        verify(scheduler).arm(campaign);
    }

    @Test
    void duplicateTargetsAreRejected() {
        assertThatThrownBy(() -> service.create(request(List.of("g1", "g1"))))
                .isInstanceOf(InvalidRequestException.class);
        assertThat(campaignStore.findAll()).isEmpty();
    }

    @Test
    void moreThanFiftyTargetsAreRejected() {
        List<String> groups = IntStream.rangeClosed(1, 51).mapToObj(i -> "g" + i).toList();

        assertThatThrownBy(() -> service.create(request(groups))).isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void exactlyFiftyTargetsAreAccepted() {
        List<String> groups = IntStream.rangeClosed(1, 50).mapToObj(i -> "g" + i).toList();

        assertThat(service.create(request(groups)).getTargetGroups()).hasSize(50);
    }

    @Test
    void overlongMessageIsRejected() {
        CampaignRequest request = request(List.of("g1"));
        request.setMessage("x".repeat(4097));

        assertThatThrownBy(() -> service.create(request)).isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void invalidScheduleIsRejectedBeforeSaving() {
        CampaignRequest request = request(List.of("g1"));
        request.setSchedule(ScheduleDescriptor.once(LocalDateTime.of(2020, 1, 1, 0, 0)));

        assertThatThrownBy(() -> service.create(request)).isInstanceOf(ScheduleValidationException.class);
        assertThat(campaignStore.findAll()).isEmpty();
        verify(scheduler, never()).arm(any());
    }

    @Test
    void updateMergesFieldsAndRearms() {
        Campaign created = service.create(request(List.of("g1")));
        clock.advance(Duration.ofMinutes(5));

        CampaignRequest changes = new CampaignRequest();
        changes.setMessage("Updated text");
        changes.setTargetGroups(new ArrayList<>(List.of("g1", "g3")));
        Campaign updated = service.update(created.getId(), changes);

        assertThat(updated.getName()).isEqualTo("Weekly promo");
        assertThat(updated.getMessage()).isEqualTo("Updated text");
        assertThat(updated.getTargetGroups()).containsExactly("g1", "g3");
        assertThat(updated.getUpdatedAt()).isEqualTo(clock.instant());
        verify(scheduler).rearm(updated);
    }

    @Test
    void pausingDisarmsAndResumingRearms() {
        Campaign created = service.create(request(List.of("g1")));

        Campaign paused = service.setStatus(created.getId(), CampaignStatus.PAUSED);
        verify(scheduler).disarm(created.getId());
        assertThat(paused.isActive()).isFalse();

        Campaign resumed = service.setStatus(created.getId(), CampaignStatus.ACTIVE);
        verify(scheduler).rearm(resumed);
    }

    @Test
    void deleteRemovesAndDisarms() {
        Campaign created = service.create(request(List.of("g1")));

        service.delete(created.getId());

        assertThat(campaignStore.findAll()).isEmpty();
        verify(scheduler).disarm(created.getId());
    }

    @Test
    void unknownCampaignIsNotFound() {
        assertThatThrownBy(() -> service.delete("missing")).isInstanceOf(ResourceNotFoundException.class);
        assertThatThrownBy(() -> service.setStatus("missing", CampaignStatus.PAUSED))
                .isInstanceOf(ResourceNotFoundException.class);
    }
}
