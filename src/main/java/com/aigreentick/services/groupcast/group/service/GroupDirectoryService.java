package com.aigreentick.services.groupcast.group.service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import com.aigreentick.services.groupcast.campaign.scheduling.TriggerService;
import com.aigreentick.services.groupcast.common.exception.NotConnectedException;
import com.aigreentick.services.groupcast.config.GroupcastProperties;
import com.aigreentick.services.groupcast.connection.enums.ConnectionState;
import com.aigreentick.services.groupcast.connection.event.ConnectionStateChangedEvent;
import com.aigreentick.services.groupcast.connection.event.GroupsUpdatedEvent;
import com.aigreentick.services.groupcast.connection.service.ActivityLog;
import com.aigreentick.services.groupcast.connection.service.ConnectionManager;
import com.aigreentick.services.groupcast.group.model.Group;
import com.aigreentick.services.groupcast.statistics.enums.StatKind;
import com.aigreentick.services.groupcast.statistics.service.StatisticsTracker;
import com.aigreentick.services.groupcast.store.enums.CollectionName;
import com.aigreentick.services.groupcast.store.service.PersistenceException;
import com.aigreentick.services.groupcast.store.service.PersistenceGateway;
import com.aigreentick.services.groupcast.transport.service.MessagingTransport;
import com.fasterxml.jackson.core.type.TypeReference;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Cached directory of the groups the session belongs to.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GroupDirectoryService {

    private static final TypeReference<List<Group>> GROUP_LIST_TYPE = new TypeReference<>() {
    };

    private final MessagingTransport transport;
    private final PersistenceGateway persistenceGateway;
    private final ConnectionManager connectionManager;
    private final StatisticsTracker statisticsTracker;
    private final TriggerService triggerService;
    private final ActivityLog activityLog;
    private final GroupcastProperties properties;
    private final Clock clock;

    public List<Group> list() {
        return persistenceGateway.read(CollectionName.GROUPS, GROUP_LIST_TYPE).orElseGet(List::of);
    }

    /**
     * Groups keyed by id, as stored at the time of the call.
     */
    public Map<String, Group> snapshotById() {
        Map<String, Group> byId = new LinkedHashMap<>();
        for (Group group : list()) {
            byId.put(group.getId(), group);
        }
        return byId;
    }

    /**
     * Fetches the current group list from the network and replaces the stored copy.
     *
     * @throws NotConnectedException if there is no live session
     */
    public List<Group> refresh() {
        if (!connectionManager.isConnected()) {
            throw new NotConnectedException("WhatsApp is not connected");
        }

        List<Group> groups = transport.listDestinations();
        if (!persistenceGateway.write(CollectionName.GROUPS, groups)) {
            throw new PersistenceException("Failed to save group list", null);
        }
        statisticsTracker.record(StatKind.GROUPS, groups.size());
        activityLog.add(groups.size() + " groups loaded");
        return groups;
    }

    @EventListener
    public void onConnectionStateChanged(ConnectionStateChangedEvent event) {
        if (event.current() == ConnectionState.CONNECTED) {
            triggerService.scheduleAt(
                    clock.instant().plus(properties.getConnection().getGroupRefreshDelay()),
                    this::refreshQuietly);
        }
    }

    @EventListener
    public void onGroupsUpdated(GroupsUpdatedEvent event) {
        log.debug("Network reported {} updated groups, refreshing directory", event.count());
        triggerService.scheduleAt(clock.instant(), this::refreshQuietly);
    }

    private void refreshQuietly() {
        if (!connectionManager.isConnected()) {
            log.debug("Skipping group refresh, not connected");
            return;
        }
        try {
            refresh();
        } catch (Exception e) {
            log.error("Failed to load groups", e);
            activityLog.add("Failed to load groups: " + e.getMessage());
        }
    }
}
