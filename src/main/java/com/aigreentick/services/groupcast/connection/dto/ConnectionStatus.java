package com.aigreentick.services.groupcast.connection.dto;

import java.util.List;

import com.aigreentick.services.groupcast.connection.enums.ConnectionState;

/**
 * Connection snapshot for the operator UI.
 *
 * @param qrCode pairing challenge as produced by the configured {@code PairingCodeRenderer};
 *               with the default renderer this is the raw challenge string, not an image.
 *               Empty unless the state is {@code qr_ready}.
 */
public record ConnectionStatus(
        ConnectionState status,
        String qrCode,
        List<ActivityEntry> logs,
        int reconnectAttempts,
        int maxReconnectAttempts) {
}
