package com.aigreentick.services.groupcast.connection.event;

import com.aigreentick.services.groupcast.connection.enums.ConnectionState;

/**
 * Published after every state transition.
 *
 * @param manual true when the transition was requested by the operator (connect/disconnect)
 */
public record ConnectionStateChangedEvent(ConnectionState previous, ConnectionState current, boolean manual) {
}
