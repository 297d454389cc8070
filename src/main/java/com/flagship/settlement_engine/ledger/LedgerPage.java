package com.flagship.settlement_engine.ledger;

import lombok.Value;

import java.util.List;

@Value
public class LedgerPage {
    List<LedgerEntry> entries;
    long total;
    int page;
    int size;
}
