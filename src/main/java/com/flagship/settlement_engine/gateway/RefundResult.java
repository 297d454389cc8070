package com.flagship.settlement_engine.gateway;

import lombok.Value;

@Value
public class RefundResult {
    String refundReference;
    String status;
}
