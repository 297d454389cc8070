package com.flagship.settlement_engine.gateway;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class GatewayTransaction {
    String paymentReference;
    String transactionReference;
    TransactionStatus status;
    String rawStatus;
    BigDecimal amountPaid;
    String paidOn;

    public boolean isPaid() {
        return status == TransactionStatus.PAID;
    }
}
