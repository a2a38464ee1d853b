package com.aigreentick.services.groupcast.connection.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ExecutorService;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;

import com.aigreentick.services.groupcast.config.GroupcastProperties;
import com.aigreentick.services.groupcast.connection.dto.ActivityEntry;
import com.aigreentick.services.groupcast.connection.enums.ConnectionState;
import com.aigreentick.services.groupcast.connection.event.ConnectionStateChangedEvent;
import com.aigreentick.services.groupcast.connection.event.GroupsUpdatedEvent;
import com.aigreentick.services.groupcast.settings.model.Settings;
import com.aigreentick.services.groupcast.settings.service.SettingsService;
import com.aigreentick.services.groupcast.support.InMemoryPersistenceGateway;
import com.aigreentick.services.groupcast.support.ManualTriggerService;
import com.aigreentick.services.groupcast.support.MutableClock;
import com.aigreentick.services.groupcast.transport.dto.StateEvent;
import com.aigreentick.services.groupcast.transport.enums.DisconnectReason;
import com.aigreentick.services.groupcast.transport.service.MessagingTransport;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

class ConnectionManagerTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

    private final GroupcastProperties properties = new GroupcastProperties();
    private final MutableClock clock = new MutableClock(NOW, ZoneOffset.UTC);
    private final ManualTriggerService triggers = new ManualTriggerService();
    private final MessagingTransport transport = mock(MessagingTransport.class);
    private final ApplicationEventPublisher publisher = mock(ApplicationEventPublisher.class);

    private SettingsService settingsService;
    private ConnectionManager manager;

    @BeforeEach
    void setUp() {
        settingsService = new SettingsService(new InMemoryPersistenceGateway(), properties);
        manager = new ConnectionManager(
                transport,
                triggers,
                new ActivityLog(properties, clock),
                settingsService,
                code -> "rendered:" + code,
                publisher,
                mock(ExecutorService.class),
                properties,
                clock);
    }

    private void transportEmits(StateEvent... events) {
        when(transport.connect(any())).thenReturn(Flux.just(events));
    }

    @Test
    void pairingThenOpenReachesConnected() {
        Sinks.Many<StateEvent> session = Sinks.many().unicast().onBackpressureBuffer();
        when(transport.connect(any())).thenReturn(session.asFlux());

        assertThat(manager.connect()).isTrue();
        assertThat(manager.getState()).isEqualTo(ConnectionState.CONNECTING);

        session.tryEmitNext(StateEvent.pairingCode("abc"));
        manager.drainPendingEvents();
        assertThat(manager.getState()).isEqualTo(ConnectionState.QR_READY);
        assertThat(manager.status().qrCode()).isEqualTo("rendered:abc");

        session.tryEmitNext(StateEvent.open());
        manager.drainPendingEvents();
        assertThat(manager.isConnected()).isTrue();
        assertThat(manager.status().qrCode()).isEmpty();
        assertThat(manager.getReconnectAttempts()).isZero();
        verify(publisher).publishEvent(new ConnectionStateChangedEvent(ConnectionState.QR_READY, ConnectionState.CONNECTED, false));
    }

    @Test
    void connectIsIgnoredWhileASessionIsInProgress() {
        when(transport.connect(any())).thenReturn(Flux.never());

        assertThat(manager.connect()).isTrue();
        assertThat(manager.connect()).isFalse();

        verify(transport, times(1)).connect(any());
    }

    @Test
    void loggedOutNeverReconnects() {
        transportEmits(StateEvent.closed(DisconnectReason.LOGGED_OUT));

        manager.connect();
        manager.drainPendingEvents();

        assertThat(manager.getState()).isEqualTo(ConnectionState.DISCONNECTED);
        assertThat(triggers.pending()).isEmpty();
        assertThat(manager.getReconnectAttempts()).isZero();
    }

    @Test
    void recoverableCloseSchedulesExactlyOneReconnect() {
        transportEmits(StateEvent.closed(DisconnectReason.CONNECTION_LOST));

        manager.connect();
        manager.drainPendingEvents();

        assertThat(manager.getState()).isEqualTo(ConnectionState.DISCONNECTED);
        assertThat(triggers.pending()).hasSize(1);
        assertThat(triggers.pending().get(0).fireAt()).isEqualTo(NOW.plus(properties.getConnection().getReconnectDelay()));
        assertThat(manager.getReconnectAttempts()).isEqualTo(1);
    }

    @Test
    void reconnectBudgetIsBoundedAndThenReset() {
        transportEmits(StateEvent.closed(DisconnectReason.CONNECTION_LOST));

        manager.connect();
        manager.drainPendingEvents();

        for (int attempt = 1; attempt <= 5; attempt++) {
            assertThat(triggers.pending()).as("attempt %d", attempt).hasSize(1);
            assertThat(manager.getReconnectAttempts()).isEqualTo(attempt);
            triggers.fireOneShots();
            manager.drainPendingEvents();
        }

        assertThat(triggers.pending()).isEmpty();
        assertThat(manager.getReconnectAttempts()).isZero();
        assertThat(manager.getState()).isEqualTo(ConnectionState.DISCONNECTED);
        verify(transport, times(6)).connect(any());
        assertThat(manager.status().logs()).extracting(ActivityEntry::message)
                .contains("Maximum reconnect attempts reached");
    }

    @Test
    void reconnectBudgetFollowsSettings() {
        Settings settings = settingsService.defaults();
        settings.getSecurity().setMaxReconnectAttempts(1);
        settingsService.update(settings);
        transportEmits(StateEvent.closed(DisconnectReason.CONNECTION_LOST));

        manager.connect();
        manager.drainPendingEvents();
        triggers.fireOneShots();
        manager.drainPendingEvents();

        assertThat(triggers.pending()).isEmpty();
        verify(transport, times(2)).connect(any());
        assertThat(manager.status().maxReconnectAttempts()).isEqualTo(1);
    }

    @Test
    void streamErrorEntersErrorStateAndRetriesLater() {
        when(transport.connect(any())).thenReturn(Flux.error(new IllegalStateException("bridge down")));

        manager.connect();
        manager.drainPendingEvents();

        assertThat(manager.getState()).isEqualTo(ConnectionState.ERROR);
        assertThat(triggers.pending()).hasSize(1);
        assertThat(triggers.pending().get(0).fireAt()).isEqualTo(NOW.plus(properties.getConnection().getErrorReconnectDelay()));
    }

    @Test
    void connectIsAllowedFromErrorState() {
        when(transport.connect(any()))
                .thenReturn(Flux.error(new IllegalStateException("bridge down")))
                .thenReturn(Flux.never());
        manager.connect();
        manager.drainPendingEvents();

        assertThat(manager.connect()).isTrue();
        assertThat(manager.getState()).isEqualTo(ConnectionState.CONNECTING);
        assertThat(triggers.pending()).isEmpty();
    }

    @Test
    void manualDisconnectCancelsPendingReconnect() {
        transportEmits(StateEvent.closed(DisconnectReason.CONNECTION_LOST));
        manager.connect();
        manager.drainPendingEvents();

        manager.disconnect();

        assertThat(triggers.pending()).isEmpty();
        assertThat(manager.getState()).isEqualTo(ConnectionState.DISCONNECTED);
        assertThat(manager.getReconnectAttempts()).isZero();
        verify(transport).logout();
        verify(publisher).publishEvent(new ConnectionStateChangedEvent(ConnectionState.DISCONNECTED, ConnectionState.DISCONNECTED, true));
    }

    @Test
    void reconnectTimerAlreadyRunningDuringDisconnectDoesNotReopen() {
        transportEmits(StateEvent.closed(DisconnectReason.CONNECTION_LOST));
        manager.connect();
        manager.drainPendingEvents();
        ManualTriggerService.ScheduledTrigger timer = triggers.pending().get(0);
        // the timer thread got past cancellation and runs while disconnect is in flight
        doAnswer(invocation -> {
            timer.fire();
            return null;
        }).when(transport).logout();

        manager.disconnect();
        manager.drainPendingEvents();

        assertThat(manager.getState()).isEqualTo(ConnectionState.DISCONNECTED);
        assertThat(triggers.pending()).as("no automatic reconnect after manual disconnect").isEmpty();
        assertThat(manager.getReconnectAttempts()).isZero();
        verify(transport, times(1)).connect(any());
    }

    @Test
    void staleReconnectTimerAfterManualConnectIsIgnored() {
        when(transport.connect(any()))
                .thenReturn(Flux.just(StateEvent.closed(DisconnectReason.CONNECTION_LOST)))
                .thenReturn(Flux.never());
        manager.connect();
        manager.drainPendingEvents();
        ManualTriggerService.ScheduledTrigger timer = triggers.pending().get(0);

        assertThat(manager.connect()).isTrue();
        timer.fire();

        assertThat(manager.getState()).isEqualTo(ConnectionState.CONNECTING);
        verify(transport, times(2)).connect(any());
    }

    @Test
    void disconnectCompletesEvenIfLogoutFails() {
        when(transport.connect(any())).thenReturn(Flux.never());
        doThrow(new IllegalStateException("gateway unreachable")).when(transport).logout();
        manager.connect();

        manager.disconnect();

        assertThat(manager.getState()).isEqualTo(ConnectionState.DISCONNECTED);
    }

    @Test
    void eventsFromSupersededSessionAreIgnored() {
        when(transport.connect(any())).thenReturn(Flux.never());
        manager.connect();
        manager.disconnect();

        manager.apply(new ConnectionManager.SessionEvent(1, StateEvent.open()));

        assertThat(manager.getState()).isEqualTo(ConnectionState.DISCONNECTED);
    }

    @Test
    void groupsUpdatedIsForwardedWhileConnected() {
        when(transport.connect(any()))
                .thenReturn(Flux.concat(Flux.just(StateEvent.open(), StateEvent.groupsUpdated(4)), Flux.never()));

        manager.connect();
        manager.drainPendingEvents();

        ArgumentCaptor<Object> published = ArgumentCaptor.forClass(Object.class);
        verify(publisher, times(3)).publishEvent(published.capture());
        List<Object> events = published.getAllValues();
        assertThat(events).contains(new GroupsUpdatedEvent(4));
    }

    @Test
    void statusReportsLatestLogsFirst() {
        when(transport.connect(any())).thenReturn(Flux.never());

        manager.connect();

        assertThat(manager.status().status()).isEqualTo(ConnectionState.CONNECTING);
        assertThat(manager.status().logs().get(0).message()).isEqualTo("Starting connection...");
        assertThat(manager.status().maxReconnectAttempts()).isEqualTo(5);
    }
}
