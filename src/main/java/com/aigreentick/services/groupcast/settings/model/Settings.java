package com.aigreentick.services.groupcast.settings.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Operator-editable settings, read on every use so changes apply without restart.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Settings {

    @Valid
    @Builder.Default
    private AntiSpam antiSpam = new AntiSpam();

    @Valid
    @Builder.Default
    private Security security = new Security();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AntiSpam {
        @Builder.Default
        private boolean enabled = true;

        @Min(value = 1, message = "Anti-spam interval must be at least 1 minute")
        @Builder.Default
        private int intervalMinutes = 30;

        @Min(value = 1, message = "Max messages per group must be at least 1")
        @Builder.Default
        private int maxMessagesPerGroup = 10;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Security {
        @Min(value = 0, message = "Max reconnect attempts cannot be negative")
        @Builder.Default
        private int maxReconnectAttempts = 5;
    }
}
