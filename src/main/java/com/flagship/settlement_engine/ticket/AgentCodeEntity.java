package com.flagship.settlement_engine.ticket;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "agent_codes")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AgentCodeEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "event_id", nullable = false, updatable = false)
    private UUID eventId;

    @Column(nullable = false, unique = true, updatable = false, length = 9, columnDefinition = "CHAR(9)")
    private String code;

    @Column(length = 100)
    private String label;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "activated_at")
    private Instant activatedAt;

    @Column(name = "last_used_at")
    private Instant lastUsedAt;

    @Column(name = "check_in_count", nullable = false)
    private int checkInCount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static AgentCodeEntity fromDomain(AgentCode agentCode) {
        return new AgentCodeEntity(
            agentCode.getId(),
            agentCode.getEventId(),
            agentCode.getCode(),
            agentCode.getLabel(),
            agentCode.isActive(),
            agentCode.getActivatedAt(),
            agentCode.getLastUsedAt(),
            agentCode.getCheckInCount(),
            agentCode.getCreatedAt()
        );
    }

    public AgentCode toDomain() {
        return new AgentCode(id, eventId, code, label, active, activatedAt, lastUsedAt, checkInCount, createdAt);
    }
}
