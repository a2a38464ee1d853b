package com.aigreentick.services.groupcast.connection.event;

/**
 * The network reported that group metadata changed.
 */
public record GroupsUpdatedEvent(int count) {
}
