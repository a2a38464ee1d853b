package com.aigreentick.services.groupcast.common.dto;

import java.time.ZonedDateTime;

public record ErrorResponse(
        ZonedDateTime timestamp,
        int status,
        String error,
        String message,
        String path) {
}
