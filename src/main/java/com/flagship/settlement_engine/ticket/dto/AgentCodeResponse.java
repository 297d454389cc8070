package com.flagship.settlement_engine.ticket.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.settlement_engine.ticket.AgentCode;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class AgentCodeResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("event_id")
    UUID eventId;

    @JsonProperty("code")
    String code;

    @JsonProperty("label")
    String label;

    @JsonProperty("is_active")
    boolean active;

    @JsonProperty("activated_at")
    Instant activatedAt;

    @JsonProperty("last_used_at")
    Instant lastUsedAt;

    @JsonProperty("check_in_count")
    int checkInCount;

    public static AgentCodeResponse from(AgentCode agentCode) {
        return AgentCodeResponse.builder()
            .id(agentCode.getId())
            .eventId(agentCode.getEventId())
            .code(agentCode.getCode())
            .label(agentCode.getLabel())
            .active(agentCode.isActive())
            .activatedAt(agentCode.getActivatedAt())
            .lastUsedAt(agentCode.getLastUsedAt())
            .checkInCount(agentCode.getCheckInCount())
            .build();
    }
}
