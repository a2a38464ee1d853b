package com.aigreentick.services.groupcast.connection.dto;

import java.time.Instant;

public record ActivityEntry(Instant timestamp, String message) {
}
