package com.aigreentick.services.groupcast.config;

import java.time.Duration;
import java.time.ZoneId;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;

@Data
@Validated
@ConfigurationProperties(prefix = "groupcast")
public class GroupcastProperties {

    @NotBlank
    private String timezone = "America/Sao_Paulo";

    private final Connection connection = new Connection();
    private final Campaigns campaigns = new Campaigns();
    private final AntiSpam antiSpam = new AntiSpam();
    private final Transport transport = new Transport();

    public ZoneId zoneId() {
        return ZoneId.of(timezone);
    }

    @Data
    public static class Connection {
        @NotBlank
        private String sessionName = "groupcast-session";
        private boolean autoConnect = true;
        private Duration autoConnectDelay = Duration.ofSeconds(2);
        private Duration reconnectDelay = Duration.ofSeconds(5);
        private Duration errorReconnectDelay = Duration.ofSeconds(10);
        private Duration groupRefreshDelay = Duration.ofSeconds(2);
        @Min(0)
        private int maxReconnectAttempts = 5;
        @Positive
        private int logCapacity = 100;
        @Positive
        private int statusLogLimit = 20;
        @Positive
        private int eventQueueCapacity = 256;
    }

    @Data
    public static class Campaigns {
        private Duration interSendDelay = Duration.ofSeconds(3);
        private Duration immediateDelay = Duration.ofSeconds(1);
        @Positive
        private int maxTargetGroups = 50;
        @Positive
        private int maxMessageLength = 4096;
    }

    @Data
    public static class AntiSpam {
        private boolean enabled = true;
        @Positive
        private int intervalMinutes = 30;
        @Positive
        private int maxMessagesPerGroup = 10;
        private Duration staleAfter = Duration.ofHours(1);
        private Duration cleanupInterval = Duration.ofMinutes(30);
    }

    @Data
    public static class Transport {
        private String baseUrl = "http://localhost:8085";
        private Duration timeout = Duration.ofSeconds(60);
    }
}
