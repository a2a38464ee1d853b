package com.aigreentick.services.groupcast.campaign.dto;

import com.aigreentick.services.groupcast.campaign.enums.FailureReason;

/**
 * Outcome of one destination within a run. {@code reason} is null when the message was sent.
 */
public record DeliveryResult(String destinationId, String destinationName, boolean sent, FailureReason reason, String detail) {

    public static DeliveryResult sent(String destinationId, String destinationName) {
        return new DeliveryResult(destinationId, destinationName, true, null, null);
    }

    public static DeliveryResult failed(String destinationId, String destinationName, FailureReason reason, String detail) {
        return new DeliveryResult(destinationId, destinationName, false, reason, detail);
    }
}
