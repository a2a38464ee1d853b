package com.aigreentick.services.groupcast.transport.enums;

public enum SessionEventType {
    CONNECTING,
    PAIRING_CODE,
    OPEN,
    CLOSE,
    ERROR,
    GROUPS_UPDATED
}
