package com.aigreentick.services.groupcast.transport.service.impl;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

import org.springframework.context.annotation.Profile;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import com.aigreentick.services.groupcast.config.GroupcastProperties;
import com.aigreentick.services.groupcast.group.model.Group;
import com.aigreentick.services.groupcast.transport.dto.DeliveryReceipt;
import com.aigreentick.services.groupcast.transport.dto.GatewayGroupList;
import com.aigreentick.services.groupcast.transport.dto.GatewaySendRequest;
import com.aigreentick.services.groupcast.transport.dto.GatewaySendResponse;
import com.aigreentick.services.groupcast.transport.dto.GatewaySessionEvent;
import com.aigreentick.services.groupcast.transport.dto.MessageContent;
import com.aigreentick.services.groupcast.transport.dto.SessionCredentials;
import com.aigreentick.services.groupcast.transport.dto.StateEvent;
import com.aigreentick.services.groupcast.transport.enums.DisconnectReason;
import com.aigreentick.services.groupcast.transport.service.MessagingTransport;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;

/**
 * Talks to a chat-network bridge over HTTP: session control, a server-sent event
 * stream of connection updates, sends and group listing.
 * Active when profile is NOT 'mock'.
 */
@Slf4j
@Service
@Profile("!mock")
public class GatewayMessagingTransport implements MessagingTransport {

    private static final String UNNAMED_GROUP = "Unnamed group";

    private final WebClient webClient;
    private final Duration timeout;

    private volatile String sessionName;

    public GatewayMessagingTransport(WebClient gatewayWebClient, GroupcastProperties properties) {
        this.webClient = gatewayWebClient;
        this.timeout = properties.getTransport().getTimeout();
        this.sessionName = properties.getConnection().getSessionName();
    }

    @Override
    public Flux<StateEvent> connect(SessionCredentials credentials) {
        this.sessionName = credentials.sessionName();

        Flux<GatewaySessionEvent> updates = webClient.get()
                .uri("/sessions/{name}/events", sessionName)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .retrieve()
                .bodyToFlux(GatewaySessionEvent.class);

        return webClient.post()
                .uri("/sessions/{name}/start", sessionName)
                .retrieve()
                .toBodilessEntity()
                .thenMany(updates)
                .concatMapIterable(GatewayMessagingTransport::toStateEvents);
    }

    static List<StateEvent> toStateEvents(GatewaySessionEvent update) {
        List<StateEvent> events = new ArrayList<>();

        if (update.getQr() != null && !update.getQr().isBlank()) {
            events.add(StateEvent.pairingCode(update.getQr()));
        }

        if (update.getConnection() != null) {
            switch (update.getConnection()) {
                case "connecting" -> events.add(StateEvent.connecting());
                case "open" -> events.add(StateEvent.open());
                case "close" -> events.add(StateEvent.closed(DisconnectReason.fromStatusCode(update.getStatusCode())));
                default -> log.debug("Ignoring unknown connection value: {}", update.getConnection());
            }
        }

        if (update.getError() != null) {
            events.add(StateEvent.error(update.getError()));
        }

        if (update.getGroupsUpdated() != null) {
            events.add(StateEvent.groupsUpdated(update.getGroupsUpdated()));
        }

        return events;
    }

    @Override
    public DeliveryReceipt sendMessage(String destinationId, MessageContent content) {
        GatewaySendRequest request = buildRequest(destinationId, content);

        try {
            GatewaySendResponse response = webClient.post()
                    .uri("/sessions/{name}/messages", sessionName)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(request)
                    .retrieve()
                    .bodyToMono(GatewaySendResponse.class)
                    .block(timeout);

            String messageId = response != null ? response.getId() : null;
            log.debug("Message sent. destination={} messageId={}", destinationId, messageId);
            return DeliveryReceipt.success(messageId);

        } catch (WebClientResponseException ex) {
            log.error("Failed to send message. destination={} Status={} Response={}",
                    destinationId, ex.getStatusCode().value(), ex.getResponseBodyAsString());
            return DeliveryReceipt.failure("Gateway returned " + ex.getStatusCode().value());

        } catch (Exception ex) {
            log.error("Unexpected error while sending message. destination={}", destinationId, ex);
            return DeliveryReceipt.failure(ex.getMessage());
        }
    }

    private GatewaySendRequest buildRequest(String destinationId, MessageContent content) {
        String text = content.text() != null ? content.text() : "";

        if (content.hasImage()) {
            try {
                byte[] image = Files.readAllBytes(Path.of(content.imagePath()));
                return GatewaySendRequest.builder()
                        .to(destinationId)
                        .image(Base64.getEncoder().encodeToString(image))
                        .caption(text)
                        .build();
            } catch (IOException e) {
                // Unreadable image: the text still goes out on its own
                log.warn("Could not read image {}. Sending text only to {}", content.imagePath(), destinationId, e);
            }
        }

        return GatewaySendRequest.builder()
                .to(destinationId)
                .text(text)
                .build();
    }

    @Override
    public List<Group> listDestinations() {
        GatewayGroupList list = webClient.get()
                .uri("/sessions/{name}/groups", sessionName)
                .retrieve()
                .bodyToMono(GatewayGroupList.class)
                .block(timeout);

        if (list == null || list.getGroups() == null) {
            return List.of();
        }

        return list.getGroups().stream()
                .map(g -> toGroup(g, list.getSelfId()))
                .toList();
    }

    static Group toGroup(GatewayGroupList.GatewayGroup group, String selfId) {
        List<GatewayGroupList.Participant> participants =
                group.getParticipants() != null ? group.getParticipants() : List.of();

        boolean admin = participants.stream()
                .anyMatch(p -> p.getId() != null && p.getId().equals(selfId)
                        && ("admin".equals(p.getAdmin()) || "superadmin".equals(p.getAdmin())));

        return Group.builder()
                .id(group.getId())
                .name(group.getSubject() != null && !group.getSubject().isBlank() ? group.getSubject() : UNNAMED_GROUP)
                .participantsCount(participants.size())
                .admin(admin)
                .description(group.getDesc() != null ? group.getDesc() : "")
                .createdAt(group.getCreation() != null ? Instant.ofEpochSecond(group.getCreation()) : null)
                .build();
    }

    @Override
    public void logout() {
        webClient.post()
                .uri("/sessions/{name}/logout", sessionName)
                .retrieve()
                .toBodilessEntity()
                .block(timeout);
        log.info("Session {} logged out", sessionName);
    }

    @Override
    public void close() {
        webClient.post()
                .uri("/sessions/{name}/close", sessionName)
                .retrieve()
                .toBodilessEntity()
                .block(timeout);
        log.info("Session {} closed", sessionName);
    }
}
