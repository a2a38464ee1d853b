package com.aigreentick.services.groupcast.settings.service;

import org.springframework.stereotype.Service;

import com.aigreentick.services.groupcast.common.exception.InvalidRequestException;
import com.aigreentick.services.groupcast.config.GroupcastProperties;
import com.aigreentick.services.groupcast.settings.model.Settings;
import com.aigreentick.services.groupcast.store.enums.CollectionName;
import com.aigreentick.services.groupcast.store.service.PersistenceException;
import com.aigreentick.services.groupcast.store.service.PersistenceGateway;
import com.fasterxml.jackson.core.type.TypeReference;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class SettingsService {

    private static final TypeReference<Settings> SETTINGS_TYPE = new TypeReference<>() {
    };

    private final PersistenceGateway persistenceGateway;
    private final GroupcastProperties properties;

    /**
     * Current settings; falls back to the configured defaults when nothing was stored yet.
     *
     * @throws PersistenceException if the stored settings cannot be read
     */
    public Settings current() {
        return persistenceGateway.read(CollectionName.SETTINGS, SETTINGS_TYPE)
                .orElseGet(this::defaults);
    }

    public Settings update(Settings settings) {
        if (settings.getAntiSpam() == null || settings.getSecurity() == null) {
            throw new InvalidRequestException("Both antiSpam and security sections are required");
        }
        if (!persistenceGateway.write(CollectionName.SETTINGS, settings)) {
            throw new PersistenceException("Failed to save settings", null);
        }
        log.info("Settings updated: antiSpam.enabled={} intervalMinutes={} maxMessagesPerGroup={} maxReconnectAttempts={}",
                settings.getAntiSpam().isEnabled(),
                settings.getAntiSpam().getIntervalMinutes(),
                settings.getAntiSpam().getMaxMessagesPerGroup(),
                settings.getSecurity().getMaxReconnectAttempts());
        return settings;
    }

    /**
     * Defaults seeded from application configuration.
     */
    public Settings defaults() {
        GroupcastProperties.AntiSpam antiSpam = properties.getAntiSpam();
        return Settings.builder()
                .antiSpam(Settings.AntiSpam.builder()
                        .enabled(antiSpam.isEnabled())
                        .intervalMinutes(antiSpam.getIntervalMinutes())
                        .maxMessagesPerGroup(antiSpam.getMaxMessagesPerGroup())
                        .build())
                .security(Settings.Security.builder()
                        .maxReconnectAttempts(properties.getConnection().getMaxReconnectAttempts())
                        .build())
                .build();
    }
}
