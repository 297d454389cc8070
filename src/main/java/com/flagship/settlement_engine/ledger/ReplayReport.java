package com.flagship.settlement_engine.ledger;

import lombok.Value;

import java.util.UUID;

/**
 * Outcome of replaying one organizer's ledger.
 * {@code firstMismatchEntryId} is null when every stored snapshot matched.
 */
@Value
public class ReplayReport {
    UUID organizerId;
    int entriesChecked;
    boolean consistent;
    UUID firstMismatchEntryId;
    OrganizerBalance replayed;
    OrganizerBalance cached;
}
