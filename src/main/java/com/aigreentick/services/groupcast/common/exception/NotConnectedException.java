package com.aigreentick.services.groupcast.common.exception;

/**
 * Raised by operations that need a live session when there is none.
 */
public class NotConnectedException extends RuntimeException {

    public NotConnectedException(String message) {
        super(message);
    }
}
