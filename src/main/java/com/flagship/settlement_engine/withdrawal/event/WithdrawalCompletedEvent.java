package com.flagship.settlement_engine.withdrawal.event;

import com.flagship.settlement_engine.outbox.SettlementEvent;
import com.flagship.settlement_engine.withdrawal.Withdrawal;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class WithdrawalCompletedEvent implements SettlementEvent {
    UUID eventId;
    UUID withdrawalId;
    UUID organizerId;
    BigDecimal amount;
    String gatewayReference;
    Instant occurredAt;

    public static final String EVENT_TYPE = "WithdrawalCompleted";
    public static final String AGGREGATE_TYPE = "Withdrawal";

    @Override
    public UUID getAggregateId() {
        return withdrawalId;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    public static WithdrawalCompletedEvent of(Withdrawal withdrawal) {
        return new WithdrawalCompletedEvent(UUID.randomUUID(), withdrawal.getId(), withdrawal.getOrganizerId(),
            withdrawal.getAmount(), withdrawal.getGatewayReference(), withdrawal.getProcessedAt());
    }
}
