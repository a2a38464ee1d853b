package com.aigreentick.services.groupcast.campaign.antispam;

import java.time.Instant;

/**
 * Sends counted for one destination in the window that opened at {@code windowStart}.
 */
record AntiSpamEntry(int count, Instant windowStart) {

    AntiSpamEntry increment() {
        return new AntiSpamEntry(count + 1, windowStart);
    }
}
