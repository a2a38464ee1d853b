package com.aigreentick.services.groupcast.campaign.scheduling;

import lombok.Getter;

/**
 * A schedule descriptor that cannot be turned into a trigger.
 */
@Getter
public class ScheduleValidationException extends RuntimeException {

    private final String field;
    private final String reason;

    public ScheduleValidationException(String field, String reason) {
        super("Invalid schedule " + field + ": " + reason);
        this.field = field;
        this.reason = reason;
    }
}
