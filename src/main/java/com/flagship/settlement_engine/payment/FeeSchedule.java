package com.flagship.settlement_engine.payment;

import com.flagship.settlement_engine.config.SettlementProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Platform fee arithmetic. The organizer is credited the net; a refund gives back the same net.
 */
@Component
public class FeeSchedule {

    private final SettlementProperties properties;

    public FeeSchedule(SettlementProperties properties) {
        this.properties = properties;
    }

    /**
     * {@code amount × (1 − platformRate)}, rounded half-up to two decimals.
     */
    public BigDecimal netOf(BigDecimal amount) {
        BigDecimal keep = BigDecimal.ONE.subtract(properties.getFees().getPlatformRate());
        return amount.multiply(keep).setScale(2, RoundingMode.HALF_UP);
    }
}
