package com.aigreentick.services.groupcast.connection.service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import com.aigreentick.services.groupcast.campaign.scheduling.TriggerHandle;
import com.aigreentick.services.groupcast.campaign.scheduling.TriggerService;
import com.aigreentick.services.groupcast.config.GroupcastProperties;
import com.aigreentick.services.groupcast.connection.dto.ConnectionStatus;
import com.aigreentick.services.groupcast.connection.enums.ConnectionState;
import com.aigreentick.services.groupcast.connection.event.ConnectionStateChangedEvent;
import com.aigreentick.services.groupcast.connection.event.GroupsUpdatedEvent;
import com.aigreentick.services.groupcast.settings.service.SettingsService;
import com.aigreentick.services.groupcast.transport.dto.SessionCredentials;
import com.aigreentick.services.groupcast.transport.dto.StateEvent;
import com.aigreentick.services.groupcast.transport.enums.DisconnectReason;
import com.aigreentick.services.groupcast.transport.service.MessagingTransport;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;

/**
 * Owns the session with the chat network.
 * <p>
 * Transport events are queued and applied one at a time by a single consumer, so the
 * state machine never sees two events at once. Every session gets a generation number;
 * events from a superseded session are dropped. Reconnects are timers, never blocking calls.
 * <p>
 * Guarded by {@code lock}: state, pairing payload, attempt counter, generation, pending reconnect.
 */
@Slf4j
@Service
public class ConnectionManager {

    private final MessagingTransport transport;
    private final TriggerService triggerService;
    private final ActivityLog activityLog;
    private final SettingsService settingsService;
    private final PairingCodeRenderer pairingCodeRenderer;
    private final ApplicationEventPublisher eventPublisher;
    private final ExecutorService connectionEventExecutor;
    private final GroupcastProperties.Connection config;
    private final Clock clock;

    private final BlockingQueue<SessionEvent> events;
    private final AtomicBoolean pumpRunning = new AtomicBoolean(false);
    private final Object lock = new Object();

    private ConnectionState state = ConnectionState.DISCONNECTED;
    private String pairingPayload;
    private int reconnectAttempts;
    private long sessionGeneration;
    private TriggerHandle pendingReconnect;
    private Disposable subscription;

    public ConnectionManager(
            MessagingTransport transport,
            TriggerService triggerService,
            ActivityLog activityLog,
            SettingsService settingsService,
            PairingCodeRenderer pairingCodeRenderer,
            ApplicationEventPublisher eventPublisher,
            @Qualifier("connectionEventExecutor") ExecutorService connectionEventExecutor,
            GroupcastProperties properties,
            Clock clock) {
        this.transport = transport;
        this.triggerService = triggerService;
        this.activityLog = activityLog;
        this.settingsService = settingsService;
        this.pairingCodeRenderer = pairingCodeRenderer;
        this.eventPublisher = eventPublisher;
        this.connectionEventExecutor = connectionEventExecutor;
        this.config = properties.getConnection();
        this.clock = clock;
        this.events = new ArrayBlockingQueue<>(config.getEventQueueCapacity());
    }

    @PostConstruct
    public void startEventPump() {
        if (pumpRunning.compareAndSet(false, true)) {
            connectionEventExecutor.submit(this::pumpEvents);
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void autoConnect() {
        if (!config.isAutoConnect()) {
            return;
        }
        triggerService.scheduleAt(clock.instant().plus(config.getAutoConnectDelay()), () -> {
            activityLog.add("System started - checking for a saved session...");
            connect();
        });
    }

    // ==================== OPERATOR ACTIONS ====================

    /**
     * Starts a session unless one is already up or being set up.
     *
     * @return false if ignored because the current state is not disconnected or error
     */
    public boolean connect() {
        List<ConnectionStateChangedEvent> changes = new ArrayList<>();
        long generation;

        synchronized (lock) {
            if (state != ConnectionState.DISCONNECTED && state != ConnectionState.ERROR) {
                log.info("Connect ignored, current state: {}", state.getValue());
                return false;
            }
            reconnectAttempts = 0;
            cancelPendingReconnect();
            generation = beginSession("Starting connection...", true, changes);
        }

        publish(changes);
        subscribe(generation);
        return true;
    }

    /**
     * Logs out and stays disconnected until the next {@link #connect()}.
     */
    public void disconnect() {
        List<ConnectionStateChangedEvent> changes = new ArrayList<>();
        Disposable previous;

        // a reconnect timer already waiting on the lock sees the new generation and gives up
        synchronized (lock) {
            sessionGeneration++;
            cancelPendingReconnect();
            previous = subscription;
            subscription = null;
            reconnectAttempts = 0;
            pairingPayload = null;
            transition(ConnectionState.DISCONNECTED, "Disconnected manually", true, changes);
        }

        try {
            transport.logout();
        } catch (Exception e) {
            log.warn("Logout failed during manual disconnect", e);
            activityLog.add("Logout failed: " + e.getMessage());
        }
        if (previous != null) {
            previous.dispose();
        }
        publish(changes);
    }

    public ConnectionState getState() {
        synchronized (lock) {
            return state;
        }
    }

    public boolean isConnected() {
        return getState() == ConnectionState.CONNECTED;
    }

    public ConnectionStatus status() {
        synchronized (lock) {
            return new ConnectionStatus(
                    state,
                    pairingPayload != null ? pairingPayload : "",
                    activityLog.latest(config.getStatusLogLimit()),
                    reconnectAttempts,
                    maxReconnectAttempts());
        }
    }

    public int getReconnectAttempts() {
        synchronized (lock) {
            return reconnectAttempts;
        }
    }

    // ==================== EVENT CHANNEL ====================

    private void subscribe(long generation) {
        try {
            Disposable disposable = transport.connect(new SessionCredentials(config.getSessionName()))
                    .subscribe(
                            event -> enqueue(generation, event),
                            error -> enqueue(generation, StateEvent.error(describe(error))),
                            () -> enqueue(generation, StateEvent.closed(DisconnectReason.CONNECTION_CLOSED)));

            synchronized (lock) {
                if (generation == sessionGeneration) {
                    subscription = disposable;
                    return;
                }
            }
            // superseded while subscribing
            disposable.dispose();
        } catch (Exception e) {
            log.error("Transport failed to open session", e);
            enqueue(generation, StateEvent.error(describe(e)));
        }
    }

    private void enqueue(long generation, StateEvent event) {
        if (!events.offer(new SessionEvent(generation, event))) {
            log.warn("Connection event queue full, dropping {} event", event.getType());
        }
    }

    private void pumpEvents() {
        while (pumpRunning.get()) {
            try {
                SessionEvent next = events.poll(1, TimeUnit.SECONDS);
                if (next != null) {
                    apply(next);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (Exception e) {
                log.error("Failed to apply connection event", e);
                activityLog.add("Connection event handling error: " + e.getMessage());
            }
        }
    }

    /**
     * Applies every queued event on the calling thread.
     *
     * @return number of events taken from the queue
     */
    int drainPendingEvents() {
        int drained = 0;
        SessionEvent next;
        while ((next = events.poll()) != null) {
            apply(next);
            drained++;
        }
        return drained;
    }

    // ==================== STATE MACHINE ====================

    void apply(SessionEvent sessionEvent) {
        List<ConnectionStateChangedEvent> changes = new ArrayList<>();
        GroupsUpdatedEvent groupsUpdated = null;
        StateEvent event = sessionEvent.event();

        synchronized (lock) {
            if (sessionEvent.generation() != sessionGeneration) {
                log.debug("Dropping {} event from superseded session", event.getType());
                return;
            }

            switch (event.getType()) {
                case CONNECTING -> {
                    if (state != ConnectionState.CONNECTING) {
                        transition(ConnectionState.CONNECTING, "Connecting...", false, changes);
                    }
                }
                case PAIRING_CODE -> onPairingCode(event.getPairingCode(), changes);
                case OPEN -> onOpen(changes);
                case CLOSE -> onClose(event.getCloseReason() != null ? event.getCloseReason() : DisconnectReason.UNKNOWN, changes);
                case ERROR -> onError(event.getMessage(), changes);
                case GROUPS_UPDATED -> {
                    if (state == ConnectionState.CONNECTED) {
                        int count = parseCount(event.getMessage());
                        activityLog.add(count + " groups updated");
                        groupsUpdated = new GroupsUpdatedEvent(count);
                    }
                }
            }
        }

        publish(changes);
        if (groupsUpdated != null) {
            eventPublisher.publishEvent(groupsUpdated);
        }
    }

    private void onPairingCode(String code, List<ConnectionStateChangedEvent> changes) {
        if (state != ConnectionState.CONNECTING && state != ConnectionState.QR_READY) {
            log.debug("Ignoring pairing code in state {}", state.getValue());
            return;
        }
        try {
            pairingPayload = pairingCodeRenderer.render(code);
            transition(ConnectionState.QR_READY, "QR code generated. Scan it to connect.", false, changes);
        } catch (Exception e) {
            log.error("Failed to render pairing code", e);
            activityLog.add("Failed to render QR code: " + e.getMessage());
        }
    }

    private void onOpen(List<ConnectionStateChangedEvent> changes) {
        if (state != ConnectionState.CONNECTING && state != ConnectionState.QR_READY) {
            log.debug("Ignoring open event in state {}", state.getValue());
            return;
        }
        reconnectAttempts = 0;
        pairingPayload = null;
        transition(ConnectionState.CONNECTED, "Connected successfully!", false, changes);
    }

    private void onClose(DisconnectReason reason, List<ConnectionStateChangedEvent> changes) {
        endSession();

        if (!reason.isRecoverable()) {
            transition(ConnectionState.DISCONNECTED, reason.getDescription() + ". Will not reconnect.", false, changes);
            return;
        }

        transition(ConnectionState.DISCONNECTED, reason.getDescription() + ". Trying to reconnect...", false, changes);
        scheduleReconnectWithinBudget(config.getReconnectDelay());
    }

    private void onError(String message, List<ConnectionStateChangedEvent> changes) {
        endSession();
        transition(ConnectionState.ERROR, "Connection error: " + message, false, changes);
        scheduleReconnectWithinBudget(config.getErrorReconnectDelay());
    }

    private void scheduleReconnectWithinBudget(Duration delay) {
        int max = maxReconnectAttempts();
        if (reconnectAttempts < max) {
            reconnectAttempts++;
            activityLog.add("Reconnect attempt " + reconnectAttempts + "/" + max + " in " + delay.toSeconds() + "s");
            cancelPendingReconnect();
            long generation = sessionGeneration;
            pendingReconnect = triggerService.scheduleAt(clock.instant().plus(delay), () -> reconnect(generation));
        } else {
            activityLog.add("Maximum reconnect attempts reached");
            reconnectAttempts = 0;
        }
    }

    /**
     * Timer body for an automatic reconnect.
     *
     * @param scheduledGeneration generation current when the timer was set; any manual
     *                            connect or disconnect since then makes this a no-op
     */
    private void reconnect(long scheduledGeneration) {
        List<ConnectionStateChangedEvent> changes = new ArrayList<>();
        long generation;

        synchronized (lock) {
            if (scheduledGeneration != sessionGeneration) {
                log.debug("Reconnect skipped, session changed since it was scheduled");
                return;
            }
            pendingReconnect = null;
            if (state != ConnectionState.DISCONNECTED && state != ConnectionState.ERROR) {
                log.debug("Reconnect skipped, current state: {}", state.getValue());
                return;
            }
            generation = beginSession("Reconnecting...", false, changes);
        }

        publish(changes);
        subscribe(generation);
    }

    // ==================== HELPERS (lock held) ====================

    private long beginSession(String message, boolean manual, List<ConnectionStateChangedEvent> changes) {
        disposeSubscription();
        pairingPayload = null;
        transition(ConnectionState.CONNECTING, message, manual, changes);
        return ++sessionGeneration;
    }

    // anything the closed session still emits is stale from here on
    private void endSession() {
        sessionGeneration++;
        pairingPayload = null;
        disposeSubscription();
    }

    private void transition(ConnectionState next, String message, boolean manual, List<ConnectionStateChangedEvent> changes) {
        ConnectionState previous = state;
        state = next;
        activityLog.add(message);
        changes.add(new ConnectionStateChangedEvent(previous, next, manual));
    }

    private void cancelPendingReconnect() {
        if (pendingReconnect != null) {
            pendingReconnect.cancel();
            pendingReconnect = null;
        }
    }

    private void disposeSubscription() {
        if (subscription != null) {
            subscription.dispose();
            subscription = null;
        }
    }

    private int maxReconnectAttempts() {
        try {
            return settingsService.current().getSecurity().getMaxReconnectAttempts();
        } catch (Exception e) {
            log.warn("Could not read reconnect settings, using configured default", e);
            return config.getMaxReconnectAttempts();
        }
    }

    // ==================== OUTSIDE THE LOCK ====================

    private void publish(List<ConnectionStateChangedEvent> changes) {
        for (ConnectionStateChangedEvent change : changes) {
            try {
                eventPublisher.publishEvent(change);
            } catch (Exception e) {
                log.error("Listener failed for {} -> {}", change.previous(), change.current(), e);
                activityLog.add("Error handling connection change: " + e.getMessage());
            }
        }
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    private static int parseCount(String value) {
        try {
            return value != null ? Integer.parseInt(value) : 0;
        } catch (NumberFormatException e) {
            log.debug("Unparseable group update count: {}", value);
            return 0;
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down ConnectionManager...");
        pumpRunning.set(false);

        Disposable previous;
        synchronized (lock) {
            sessionGeneration++;
            cancelPendingReconnect();
            previous = subscription;
            subscription = null;
        }
        if (previous != null) {
            previous.dispose();
        }

        try {
            transport.close();
        } catch (Exception e) {
            log.warn("Failed to close transport session", e);
        }
        log.info("ConnectionManager shutdown complete");
    }

    record SessionEvent(long generation, StateEvent event) {
    }
}
