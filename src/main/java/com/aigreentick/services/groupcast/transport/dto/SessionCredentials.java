package com.aigreentick.services.groupcast.transport.dto;

/**
 * Identifies the persisted session to resume on the network side.
 */
public record SessionCredentials(String sessionName) {
}
