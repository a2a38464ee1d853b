package com.aigreentick.services.groupcast.statistics.enums;

public enum StatKind {
    SENT,
    FAILED,
    /** Snapshot of the current destination count, overwritten rather than summed. */
    GROUPS
}
