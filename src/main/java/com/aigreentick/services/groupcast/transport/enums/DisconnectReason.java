package com.aigreentick.services.groupcast.transport.enums;

/**
 * Why the network closed the session. Only {@link #LOGGED_OUT} is terminal.
 */
public enum DisconnectReason {

    BAD_SESSION("Invalid session"),
    CONNECTION_CLOSED("Connection closed"),
    CONNECTION_LOST("Connection lost"),
    CONNECTION_REPLACED("Connection replaced"),
    LOGGED_OUT("Logged out"),
    RESTART_REQUIRED("Restart required"),
    TIMED_OUT("Timed out"),
    UNKNOWN("Connection lost");

    private final String description;

    DisconnectReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isRecoverable() {
        return this != LOGGED_OUT;
    }

    /**
     * Maps the status code a gateway reports with a closed connection.
     */
    public static DisconnectReason fromStatusCode(Integer code) {
        if (code == null) {
            return UNKNOWN;
        }
        return switch (code) {
            case 401 -> LOGGED_OUT;
            case 408 -> CONNECTION_LOST;
            case 428 -> CONNECTION_CLOSED;
            case 440 -> CONNECTION_REPLACED;
            case 500 -> BAD_SESSION;
            case 515 -> RESTART_REQUIRED;
            default -> UNKNOWN;
        };
    }
}
