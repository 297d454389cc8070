package com.flagship.settlement_engine.common.actor;

import com.flagship.settlement_engine.common.exception.ErrorCode;
import com.flagship.settlement_engine.common.exception.SettlementException;

import java.util.Locale;
import java.util.UUID;

/**
 * The authenticated caller, as asserted by the gateway in front of this service.
 * Identity is established upstream; this service only reads the propagated headers.
 */
public record Actor(UUID id, ActorRole role) {

    public static final String ID_HEADER = "X-Actor-Id";
    public static final String ROLE_HEADER = "X-Actor-Role";

    public static Actor of(UUID id, String role) {
        if (id == null || role == null || role.isBlank()) {
            throw new SettlementException(ErrorCode.FORBIDDEN, "Caller identity is missing");
        }
        try {
            return new Actor(id, ActorRole.valueOf(role.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            throw new SettlementException(ErrorCode.FORBIDDEN, "Unknown role: " + role);
        }
    }

    public boolean isAdmin() {
        return role == ActorRole.ADMIN;
    }

    /**
     * True when the caller is an admin or the given organizer.
     */
    public boolean actsFor(UUID organizerId) {
        return isAdmin() || (role == ActorRole.ORGANIZER && id.equals(organizerId));
    }

    public void requireAdmin() {
        if (!isAdmin()) {
            throw new SettlementException(ErrorCode.FORBIDDEN, "Admin role required");
        }
    }

    public void requireActsFor(UUID organizerId) {
        if (!actsFor(organizerId)) {
            throw new SettlementException(ErrorCode.FORBIDDEN, "Caller may not act for organizer " + organizerId);
        }
    }
}
