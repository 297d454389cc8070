package com.flagship.settlement_engine.gateway;

import lombok.Value;

@Value
public class PayoutResult {
    String reference;
    PayoutStatus status;
    String message;
}
