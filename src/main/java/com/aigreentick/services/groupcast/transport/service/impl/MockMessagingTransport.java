package com.aigreentick.services.groupcast.transport.service.impl;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import com.aigreentick.services.groupcast.group.model.Group;
import com.aigreentick.services.groupcast.transport.dto.DeliveryReceipt;
import com.aigreentick.services.groupcast.transport.dto.MessageContent;
import com.aigreentick.services.groupcast.transport.dto.SessionCredentials;
import com.aigreentick.services.groupcast.transport.dto.StateEvent;
import com.aigreentick.services.groupcast.transport.service.MessagingTransport;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Simulated network for local runs: pairs, connects and delivers without a real session.
 * Active when profile is 'mock'.
 */
@Slf4j
@Service
@Profile("mock")
public class MockMessagingTransport implements MessagingTransport {

    private static final Random random = new Random();

    private static final int MIN_DELAY_MS = 50;
    private static final int MAX_DELAY_MS = 200;
    private static final double FAILURE_RATE = 0.05;

    private final AtomicLong totalCalls = new AtomicLong(0);
    private final AtomicLong failedCalls = new AtomicLong(0);

    @Override
    public Flux<StateEvent> connect(SessionCredentials credentials) {
        log.info("Mock session {} starting", credentials.sessionName());
        return Flux.concat(
                        Mono.just(StateEvent.connecting()),
                        Mono.just(StateEvent.pairingCode("mock-pairing-" + UUID.randomUUID()))
                                .delayElement(Duration.ofMillis(500)),
                        Mono.just(StateEvent.open()).delayElement(Duration.ofSeconds(2)))
                .concatWith(Flux.never());
    }

    @Override
    public DeliveryReceipt sendMessage(String destinationId, MessageContent content) {
        long callNumber = totalCalls.incrementAndGet();

        try {
            Thread.sleep(MIN_DELAY_MS + random.nextInt(MAX_DELAY_MS - MIN_DELAY_MS + 1));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failedCalls.incrementAndGet();
            return DeliveryReceipt.failure("Request interrupted");
        }

        if (random.nextDouble() < FAILURE_RATE) {
            failedCalls.incrementAndGet();
            log.debug("Mock send #{} to {} failed", callNumber, destinationId);
            return DeliveryReceipt.failure("Simulated network timeout");
        }

        return DeliveryReceipt.success("mock." + UUID.randomUUID().toString().replace("-", "") + "_" + callNumber);
    }

    @Override
    public List<Group> listDestinations() {
        return List.of(
                sampleGroup("120363000000000001@g.us", "Promotions", 120, true),
                sampleGroup("120363000000000002@g.us", "Customers", 250, false),
                sampleGroup("120363000000000003@g.us", "Team", 12, true));
    }

    private Group sampleGroup(String id, String name, int participants, boolean admin) {
        return Group.builder()
                .id(id)
                .name(name)
                .participantsCount(participants)
                .admin(admin)
                .description("")
                .createdAt(Instant.parse("2025-01-01T00:00:00Z"))
                .build();
    }

    @Override
    public void logout() {
        log.info("Mock session logged out. Calls: {}, Failed: {}", totalCalls.get(), failedCalls.get());
    }

    @Override
    public void close() {
        log.info("Mock session closed");
    }
}
