package com.flagship.settlement_engine.withdrawal.event;

import com.flagship.settlement_engine.outbox.SettlementEvent;
import com.flagship.settlement_engine.withdrawal.Withdrawal;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A withdrawal ended FAILED. {@code compensated} is true when a debit had been
 * taken and was reversed.
 */
@Value
public class WithdrawalFailedEvent implements SettlementEvent {
    UUID eventId;
    UUID withdrawalId;
    UUID organizerId;
    BigDecimal amount;
    String reason;
    boolean compensated;
    Instant occurredAt;

    public static final String EVENT_TYPE = "WithdrawalFailed";

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
        return WithdrawalCompletedEvent.AGGREGATE_TYPE;
    }

    public static WithdrawalFailedEvent of(Withdrawal withdrawal, boolean compensated) {
        return new WithdrawalFailedEvent(UUID.randomUUID(), withdrawal.getId(), withdrawal.getOrganizerId(),
            withdrawal.getAmount(), withdrawal.getFailureReason(), compensated, withdrawal.getUpdatedAt());
    }
}
