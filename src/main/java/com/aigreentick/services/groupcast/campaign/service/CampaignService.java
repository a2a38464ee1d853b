package com.aigreentick.services.groupcast.campaign.service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.UUID;

import org.springframework.stereotype.Service;

import com.aigreentick.services.groupcast.campaign.dto.CampaignRequest;
import com.aigreentick.services.groupcast.campaign.enums.CampaignStatus;
import com.aigreentick.services.groupcast.campaign.model.Campaign;
import com.aigreentick.services.groupcast.campaign.model.CampaignStats;
import com.aigreentick.services.groupcast.campaign.repository.CampaignStore;
import com.aigreentick.services.groupcast.campaign.scheduling.ScheduleTranslator;
import com.aigreentick.services.groupcast.common.exception.InvalidRequestException;
import com.aigreentick.services.groupcast.common.exception.ResourceNotFoundException;
import com.aigreentick.services.groupcast.config.GroupcastProperties;
import com.aigreentick.services.groupcast.connection.service.ActivityLog;
import com.aigreentick.services.groupcast.statistics.service.StatisticsTracker;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class CampaignService {

    private final CampaignStore campaignStore;
    private final CampaignScheduler campaignScheduler;
    private final ScheduleTranslator scheduleTranslator;
    private final StatisticsTracker statisticsTracker;
    private final ActivityLog activityLog;
    private final GroupcastProperties properties;
    private final Clock clock;

    public List<Campaign> list() {
        return campaignStore.findAll();
    }

    public Campaign get(String id) {
        return campaignStore.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Campaign not found: " + id));
    }

    /**
     * Validates, stores and arms a new campaign. The schedule is checked before anything is saved.
     */
    public Campaign create(CampaignRequest request) {
        validateContent(request.getMessage(), request.getTargetGroups());
        scheduleTranslator.translate(request.getSchedule());

        Instant now = clock.instant();
        Campaign campaign = Campaign.builder()
                .id(UUID.randomUUID().toString())
                .name(request.getName().trim())
                .message(request.getMessage())
                .imagePath(blankToNull(request.getImagePath()))
                .targetGroups(new ArrayList<>(request.getTargetGroups()))
                .schedule(request.getSchedule())
                .status(CampaignStatus.ACTIVE)
                .createdAt(now)
                .updatedAt(now)
                .stats(new CampaignStats())
                .build();

        campaignStore.save(campaign);
        statisticsTracker.recordCampaignCreated();
        campaignScheduler.arm(campaign);

        activityLog.add("Campaign \"" + campaign.getName() + "\" created");
        log.info("Campaign created. id={} groups={} schedule={}",
                campaign.getId(), campaign.getTargetGroups().size(), campaign.getSchedule().getType());
        return campaign;
    }

    /**
     * Merges the non-null fields of {@code request} into the stored campaign and re-arms it.
     */
    public Campaign update(String id, CampaignRequest request) {
        Campaign current = get(id);

        String message = request.getMessage() != null ? request.getMessage() : current.getMessage();
        List<String> targets = request.getTargetGroups() != null ? request.getTargetGroups() : current.getTargetGroups();
        validateContent(message, targets);
        if (request.getSchedule() != null) {
            scheduleTranslator.translate(request.getSchedule());
        }

        Campaign updated = campaignStore.update(id, stored -> {
            if (request.getName() != null && !request.getName().isBlank()) {
                stored.setName(request.getName().trim());
            }
            stored.setMessage(message);
            if (request.getImagePath() != null) {
                stored.setImagePath(blankToNull(request.getImagePath()));
            }
            stored.setTargetGroups(new ArrayList<>(targets));
            if (request.getSchedule() != null) {
                stored.setSchedule(request.getSchedule());
            }
            stored.setUpdatedAt(clock.instant());
        }).orElseThrow(() -> new ResourceNotFoundException("Campaign not found: " + id));

        campaignScheduler.rearm(updated);
        log.info("Campaign updated. id={}", id);
        return updated;
    }

    public Campaign setStatus(String id, CampaignStatus status) {
        Campaign updated = campaignStore.update(id, stored -> {
            stored.setStatus(status);
            stored.setUpdatedAt(clock.instant());
        }).orElseThrow(() -> new ResourceNotFoundException("Campaign not found: " + id));

        if (updated.isActive()) {
            campaignScheduler.rearm(updated);
        } else {
            campaignScheduler.disarm(id);
        }
        activityLog.add("Campaign \"" + updated.getName() + "\" " + (updated.isActive() ? "activated" : "paused"));
        return updated;
    }

    public void delete(String id) {
        campaignScheduler.disarm(id);
        if (!campaignStore.delete(id)) {
            throw new ResourceNotFoundException("Campaign not found: " + id);
        }
        log.info("Campaign deleted. id={}", id);
    }

    private void validateContent(String message, List<String> targetGroups) {
        GroupcastProperties.Campaigns limits = properties.getCampaigns();

        if (message == null || message.isBlank()) {
            throw new InvalidRequestException("Message is required");
        }
        if (message.length() > limits.getMaxMessageLength()) {
            throw new InvalidRequestException(
                    "Message is too long (max " + limits.getMaxMessageLength() + " characters)");
        }
        if (targetGroups == null || targetGroups.isEmpty()) {
            throw new InvalidRequestException("Select at least one group");
        }
        if (targetGroups.size() > limits.getMaxTargetGroups()) {
            throw new InvalidRequestException("Maximum of " + limits.getMaxTargetGroups() + " groups per campaign");
        }
        if (new HashSet<>(targetGroups).size() != targetGroups.size()) {
            throw new InvalidRequestException("Target groups must not contain duplicates");
        }
        if (targetGroups.stream().anyMatch(g -> g == null || g.isBlank())) {
            throw new InvalidRequestException("Target group ids must not be blank");
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
