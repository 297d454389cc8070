package com.flagship.settlement_engine.gateway;

import lombok.Value;

@Value
public class ResolvedAccount {
    String accountNumber;
    String accountName;
    String bankCode;
}
