package com.aigreentick.services.groupcast.campaign.scheduling;

/**
 * A live scheduled callback.
 */
public interface TriggerHandle {

    /**
     * Prevents future fires. A callback that is already running is left to finish.
     */
    void cancel();

    boolean isCancelled();
}
