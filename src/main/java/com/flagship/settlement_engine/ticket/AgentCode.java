package com.flagship.settlement_engine.ticket;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A capability token for door staff. Whoever presents an active code may check
 * tickets in for its one event; there is no account behind it.
 */
@Value
public class AgentCode {
    UUID id;
    UUID eventId;
    String code;
    String label;
    boolean active;
    Instant activatedAt;
    Instant lastUsedAt;
    int checkInCount;
    Instant createdAt;

    public static AgentCode create(UUID id, UUID eventId, String code, String label, Instant now) {
        return new AgentCode(id, eventId, code, label, true, null, null, 0, now);
    }

    /**
     * A code that has checked someone in is part of the audit trail and must not be deleted.
     */
    public boolean hasBeenUsed() {
        return checkInCount > 0 || lastUsedAt != null;
    }

    /**
     * Name recorded on tickets checked in with this code.
     */
    public String displayName() {
        return label != null && !label.isBlank() ? label : code;
    }
}
