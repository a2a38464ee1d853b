package com.aigreentick.services.groupcast.connection.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.aigreentick.services.groupcast.connection.service.PairingCodeRenderer;

@Configuration
public class ConnectionConfig {

    /**
     * The operator UI draws the QR image itself, so the raw challenge is passed through.
     */
    @Bean
    @ConditionalOnMissingBean
    public PairingCodeRenderer pairingCodeRenderer() {
        return pairingCode -> pairingCode;
    }
}
