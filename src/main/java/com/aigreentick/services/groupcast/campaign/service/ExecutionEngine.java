package com.aigreentick.services.groupcast.campaign.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.aigreentick.services.groupcast.campaign.antispam.AntiSpamLimiter;
import com.aigreentick.services.groupcast.campaign.dto.DeliveryResult;
import com.aigreentick.services.groupcast.campaign.dto.ExecutionSummary;
import com.aigreentick.services.groupcast.campaign.enums.FailureReason;
import com.aigreentick.services.groupcast.campaign.model.Campaign;
import com.aigreentick.services.groupcast.campaign.model.CampaignStats;
import com.aigreentick.services.groupcast.campaign.model.ExecutionRecord;
import com.aigreentick.services.groupcast.campaign.repository.CampaignStore;
import com.aigreentick.services.groupcast.config.GroupcastProperties;
import com.aigreentick.services.groupcast.connection.service.ActivityLog;
import com.aigreentick.services.groupcast.connection.service.ConnectionManager;
import com.aigreentick.services.groupcast.group.model.Group;
import com.aigreentick.services.groupcast.group.service.GroupDirectoryService;
import com.aigreentick.services.groupcast.statistics.enums.StatKind;
import com.aigreentick.services.groupcast.statistics.service.StatisticsTracker;
import com.aigreentick.services.groupcast.transport.dto.DeliveryReceipt;
import com.aigreentick.services.groupcast.transport.dto.MessageContent;
import com.aigreentick.services.groupcast.transport.service.MessagingTransport;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a campaign once: sends its message to each target group in order,
 * pacing between sends, then records the run.
 * <p>
 * A failed destination never aborts the run. Every target ends up counted
 * exactly once as sent or failed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExecutionEngine {

    private final CampaignStore campaignStore;
    private final GroupDirectoryService groupDirectoryService;
    private final ConnectionManager connectionManager;
    private final AntiSpamLimiter antiSpamLimiter;
    private final MessagingTransport transport;
    private final StatisticsTracker statisticsTracker;
    private final ActivityLog activityLog;
    private final GroupcastProperties properties;
    private final Clock clock;

    public ExecutionSummary execute(Campaign campaign) {
        Instant startedAt = clock.instant();

        if (!campaign.isActive()) {
            log.info("Campaign {} is paused, skipping run", campaign.getId());
            return ExecutionSummary.skipped(campaign.getId(), startedAt);
        }
        if (!connectionManager.isConnected()) {
            activityLog.add("Campaign \"" + campaign.getName() + "\" not executed: WhatsApp is not connected");
            return ExecutionSummary.skipped(campaign.getId(), startedAt);
        }

        activityLog.add("Executing campaign: " + campaign.getName());

        Map<String, Group> directory = groupDirectoryService.snapshotById();
        MessageContent content = new MessageContent(campaign.getMessage(), campaign.getImagePath());
        List<String> targets = campaign.getTargetGroups() != null ? campaign.getTargetGroups() : List.of();
        Duration pacing = properties.getCampaigns().getInterSendDelay();

        List<DeliveryResult> deliveries = new ArrayList<>(targets.size());
        for (int i = 0; i < targets.size(); i++) {
            deliveries.add(deliver(targets.get(i), directory.get(targets.get(i)), content));

            boolean last = i == targets.size() - 1;
            if (!last && !pause(pacing)) {
                for (String remaining : targets.subList(i + 1, targets.size())) {
                    deliveries.add(DeliveryResult.failed(remaining, null, FailureReason.INTERRUPTED, "run interrupted"));
                }
                log.warn("Campaign {} interrupted after {} of {} groups", campaign.getId(), i + 1, targets.size());
                break;
            }
        }

        int sent = (int) deliveries.stream().filter(DeliveryResult::sent).count();
        int failed = deliveries.size() - sent;

        recordRun(campaign, startedAt, sent, failed);
        activityLog.add("Campaign \"" + campaign.getName() + "\" completed: " + sent + " sent, " + failed + " failed");

        return new ExecutionSummary(campaign.getId(), startedAt, false, sent, failed, List.copyOf(deliveries));
    }

    private DeliveryResult deliver(String groupId, Group group, MessageContent content) {
        if (group == null) {
            log.warn("Group {} not found in directory", groupId);
            activityLog.add("Group " + groupId + " not found, message not sent");
            return DeliveryResult.failed(groupId, null, FailureReason.DESTINATION_NOT_FOUND, "group not found");
        }

        if (!antiSpamLimiter.tryAcquire(groupId)) {
            activityLog.add("Anti-spam: limit reached for group " + group.getName());
            return DeliveryResult.failed(groupId, group.getName(), FailureReason.ANTI_SPAM_REJECTED, "anti-spam limit reached");
        }

        try {
            DeliveryReceipt receipt = transport.sendMessage(groupId, content);
            if (receipt != null && receipt.success()) {
                log.info("Message sent to group {} ({})", group.getName(), groupId);
                return DeliveryResult.sent(groupId, group.getName());
            }
            String error = receipt != null ? receipt.error() : "no receipt";
            log.warn("Send to group {} failed: {}", groupId, error);
            activityLog.add("Error sending to " + group.getName() + ": " + error);
            return DeliveryResult.failed(groupId, group.getName(), FailureReason.TRANSPORT_ERROR, error);
        } catch (Exception e) {
            log.error("Error sending to group {}", groupId, e);
            activityLog.add("Error sending to " + group.getName() + ": " + e.getMessage());
            return DeliveryResult.failed(groupId, group.getName(), FailureReason.TRANSPORT_ERROR, e.getMessage());
        }
    }

    /**
     * @return false if the thread was interrupted while waiting
     */
    private static boolean pause(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void recordRun(Campaign campaign, Instant startedAt, int sent, int failed) {
        try {
            boolean found = campaignStore.update(campaign.getId(), stored -> {
                if (stored.getStats() == null) {
                    stored.setStats(new CampaignStats());
                }
                stored.getStats().recordExecution(new ExecutionRecord(startedAt, sent, failed));
            }).isPresent();
            if (!found) {
                log.warn("Campaign {} was deleted during its run, execution history not saved", campaign.getId());
            }
        } catch (Exception e) {
            log.error("Failed to save execution history for campaign {}", campaign.getId(), e);
            activityLog.add("Failed to save execution history for \"" + campaign.getName() + "\": " + e.getMessage());
        }

        statisticsTracker.record(StatKind.SENT, sent);
        statisticsTracker.record(StatKind.FAILED, failed);
    }
}
