package com.flagship.settlement_engine.gateway;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class PayoutRequest {
    String reference;
    BigDecimal amount;
    String bankCode;
    String accountNumber;
    String accountName;
    String narration;
}
