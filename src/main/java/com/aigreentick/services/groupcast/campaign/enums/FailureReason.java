package com.aigreentick.services.groupcast.campaign.enums;

/**
 * Why a single delivery in a run did not go out.
 */
public enum FailureReason {
    DESTINATION_NOT_FOUND,
    ANTI_SPAM_REJECTED,
    TRANSPORT_ERROR,
    INTERRUPTED
}
