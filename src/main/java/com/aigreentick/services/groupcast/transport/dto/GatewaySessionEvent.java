package com.aigreentick.services.groupcast.transport.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Server-sent connection update from the gateway. Several fields may be set at once.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GatewaySessionEvent {

    private String connection; // "connecting" | "open" | "close"

    private String qr;

    private Integer statusCode;

    private String error;

    private Integer groupsUpdated;
}
