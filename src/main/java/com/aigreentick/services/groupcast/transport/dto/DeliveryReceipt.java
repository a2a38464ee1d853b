package com.aigreentick.services.groupcast.transport.dto;

/**
 * Result of a single send through the transport.
 */
public record DeliveryReceipt(boolean success, String messageId, String error) {

    public static DeliveryReceipt success(String messageId) {
        return new DeliveryReceipt(true, messageId, null);
    }

    public static DeliveryReceipt failure(String error) {
        return new DeliveryReceipt(false, null, error);
    }
}
