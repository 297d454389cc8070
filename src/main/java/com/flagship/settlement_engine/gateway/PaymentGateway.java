package com.flagship.settlement_engine.gateway;

import java.math.BigDecimal;

/**
 * The external payment processor. Every call is blocking network I/O and may
 * fail with {@link com.flagship.settlement_engine.common.exception.GatewayUnavailableException}
 * (outcome unknown, retry later) or
 * {@link com.flagship.settlement_engine.common.exception.GatewayRejectedException}
 * (the gateway refused this attempt).
 *
 * Callers never hold a database lock across these calls.
 */
public interface PaymentGateway {

    /**
     * Authoritative status of the transaction paid against our payment reference.
     */
    GatewayTransaction verifyTransaction(String paymentReference);

    PayoutResult initiatePayout(PayoutRequest request);

    /**
     * Status of a payout previously sent with {@code reference}. Unknown
     * references come back as {@link PayoutStatus#NOT_FOUND}.
     */
    PayoutResult getPayoutStatus(String reference);

    RefundResult refundTransaction(String transactionReference, String refundReference,
                                   BigDecimal amount, String reason);

    ResolvedAccount resolveAccount(String accountNumber, String bankCode);
}
