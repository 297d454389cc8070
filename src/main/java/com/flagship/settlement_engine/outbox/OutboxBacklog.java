package com.flagship.settlement_engine.outbox;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of what the publisher still owes the broker.
 *
 * @param publishable events neither published nor dead-lettered
 * @param deadLettered events parked for manual inspection
 * @param oldestPublishableAt creation time of the oldest publishable event, null when there is none
 */
public record OutboxBacklog(long publishable, long deadLettered, Instant oldestPublishableAt) {

    public static final OutboxBacklog EMPTY = new OutboxBacklog(0, 0, null);

    public long oldestAgeSeconds(Instant now) {
        if (oldestPublishableAt == null) {
            return 0;
        }
        return Math.max(0, Duration.between(oldestPublishableAt, now).getSeconds());
    }
}
