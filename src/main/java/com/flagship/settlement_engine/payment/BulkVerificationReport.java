package com.flagship.settlement_engine.payment;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Counts from a batch of verifications. A payment that threw counts as failed
 * for the batch; its own status is left for the next run.
 */
@Value
public class BulkVerificationReport {

    @JsonProperty("total")
    int total;

    @JsonProperty("verified")
    int verified;

    @JsonProperty("still_pending")
    int stillPending;

    @JsonProperty("failed")
    int failed;
}
