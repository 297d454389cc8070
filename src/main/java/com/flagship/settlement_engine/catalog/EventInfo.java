package com.flagship.settlement_engine.catalog;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Read-only view of an event. Owned by the catalog side of the marketplace.
 */
@Value
public class EventInfo {
    UUID id;
    UUID organizerId;
    String title;
    Instant startDate;
    Instant endDate;

    /**
     * End of the event, falling back to the start when no end was published.
     */
    public Instant effectiveEnd() {
        return endDate != null ? endDate : startDate;
    }

    public boolean hasStarted(Instant now) {
        return !now.isBefore(startDate);
    }
}
