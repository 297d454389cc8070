package com.flagship.settlement_engine.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.settlement_engine.common.exception.GatewayRejectedException;
import com.flagship.settlement_engine.common.exception.GatewayUnavailableException;
import com.flagship.settlement_engine.observability.SettlementMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Monnify-style gateway over Spring's {@link RestClient}.
 *
 * Every response is an envelope {@code {requestSuccessful, responseMessage, responseBody}}.
 * Failures are split in two:
 * - no answer, a timeout or a 5xx: {@link GatewayUnavailableException}, outcome unknown
 * - a 4xx or {@code requestSuccessful=false}: {@link GatewayRejectedException}
 *
 * Bearer tokens come from a Basic-auth login and are cached until shortly before they expire.
 */
@Component
@Slf4j
public class HttpPaymentGateway implements PaymentGateway {

    private static final int NARRATION_LIMIT = 100;

    private final RestClient restClient;
    private final GatewayProperties properties;
    private final SettlementMetrics metrics;
    private final Clock clock;

    private final AtomicReference<AccessToken> cachedToken = new AtomicReference<>();

    private record AccessToken(String value, Instant expiresAt) {
    }

    public HttpPaymentGateway(RestClient gatewayRestClient, GatewayProperties properties,
                              SettlementMetrics metrics, Clock clock) {
        this.restClient = gatewayRestClient;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public GatewayTransaction verifyTransaction(String paymentReference) {
        String token = accessToken();
        JsonNode body = call("verify_transaction", () -> restClient.get()
            .uri("/api/v2/merchant/transactions/query?paymentReference={reference}", paymentReference)
            .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
            .retrieve()
            .body(JsonNode.class));

        String rawStatus = body.path("paymentStatus").asText(null);
        GatewayTransaction transaction = new GatewayTransaction(
            body.path("paymentReference").asText(paymentReference),
            body.path("transactionReference").asText(null),
            TransactionStatus.fromGateway(rawStatus),
            rawStatus,
            decimal(body.path("amountPaid")),
            body.path("paidOn").asText(null)
        );

        log.info("Gateway transaction status: reference={}, raw={}, normalised={}, amountPaid={}",
            paymentReference, rawStatus, transaction.getStatus(), transaction.getAmountPaid());
        return transaction;
    }

    @Override
    public PayoutResult initiatePayout(PayoutRequest request) {
        if (isBlank(properties.getWalletAccountNumber())) {
            throw new GatewayRejectedException("No source wallet configured for payouts");
        }
        String token = accessToken();

        String narration = request.getNarration() != null && request.getNarration().length() > NARRATION_LIMIT
            ? request.getNarration().substring(0, NARRATION_LIMIT)
            : request.getNarration();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("amount", request.getAmount());
        payload.put("reference", request.getReference());
        payload.put("narration", narration);
        payload.put("destinationBankCode", request.getBankCode());
        payload.put("destinationAccountNumber", request.getAccountNumber());
        payload.put("destinationAccountName", request.getAccountName());
        payload.put("currency", properties.getCurrency());
        payload.put("sourceAccountNumber", properties.getWalletAccountNumber());

        JsonNode body = call("initiate_payout", () -> restClient.post()
            .uri("/api/v2/disbursements/single")
            .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
            .contentType(MediaType.APPLICATION_JSON)
            .body(payload)
            .retrieve()
            .body(JsonNode.class));

        String rawStatus = body.path("status").asText(null);
        log.info("Payout initiated: reference={}, status={}", request.getReference(), rawStatus);
        return new PayoutResult(
            body.path("reference").asText(request.getReference()),
            PayoutStatus.fromGateway(rawStatus),
            rawStatus
        );
    }

    @Override
    public PayoutResult getPayoutStatus(String reference) {
        String token = accessToken();
        try {
            JsonNode body = call("payout_status", () -> restClient.get()
                .uri("/api/v2/disbursements/single/summary?reference={reference}", reference)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .retrieve()
                .body(JsonNode.class));

            String rawStatus = body.path("status").asText(null);
            return new PayoutResult(reference, PayoutStatus.fromGateway(rawStatus), rawStatus);
        } catch (UnknownReferenceException e) {
            return new PayoutResult(reference, PayoutStatus.NOT_FOUND, e.getMessage());
        }
    }

    @Override
    public RefundResult refundTransaction(String transactionReference, String refundReference,
                                          BigDecimal amount, String reason) {
        String token = accessToken();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("transactionReference", transactionReference);
        payload.put("refundReference", refundReference);
        payload.put("refundReason", reason);
        payload.put("refundAmount", amount);

        JsonNode body = call("refund_transaction", () -> restClient.post()
            .uri("/api/v1/refunds/initiate-refund")
            .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
            .contentType(MediaType.APPLICATION_JSON)
            .body(payload)
            .retrieve()
            .body(JsonNode.class));

        log.info("Refund initiated: transactionReference={}, refundReference={}, amount={}",
            transactionReference, refundReference, amount);
        return new RefundResult(
            body.path("refundReference").asText(refundReference),
            body.path("refundStatus").asText(null)
        );
    }

    @Override
    public ResolvedAccount resolveAccount(String accountNumber, String bankCode) {
        String token = accessToken();
        JsonNode body = call("resolve_account", () -> restClient.get()
            .uri("/api/v1/disbursements/account/validate?accountNumber={account}&bankCode={bank}",
                accountNumber, bankCode)
            .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
            .retrieve()
            .body(JsonNode.class));

        return new ResolvedAccount(
            body.path("accountNumber").asText(accountNumber),
            body.path("accountName").asText(null),
            bankCode
        );
    }

    /**
     * Returns the cached token, logging in when it is missing or about to expire.
     * The login runs without a lock; concurrent refreshes may both log in and the
     * last one published wins.
     */
    String accessToken() {
        Instant now = clock.instant();
        AccessToken current = cachedToken.get();
        if (current != null && now.isBefore(current.expiresAt().minus(properties.getTokenRefreshMargin()))) {
            return current.value();
        }

        String credentials = Base64.getEncoder().encodeToString(
            (nullToEmpty(properties.getApiKey()) + ":" + nullToEmpty(properties.getSecretKey()))
                .getBytes(StandardCharsets.UTF_8));

        JsonNode body = call("login", () -> restClient.post()
            .uri("/api/v1/auth/login")
            .header(HttpHeaders.AUTHORIZATION, "Basic " + credentials)
            .retrieve()
            .body(JsonNode.class));

        String token = body.path("accessToken").asText(null);
        if (isBlank(token)) {
            throw new GatewayUnavailableException("Gateway login returned no access token");
        }
        AccessToken refreshed = new AccessToken(token, now.plusSeconds(body.path("expiresIn").asLong(3600)));
        cachedToken.set(refreshed);
        log.debug("Gateway access token refreshed, expires at {}", refreshed.expiresAt());
        return refreshed.value();
    }

    private void invalidateToken() {
        cachedToken.set(null);
    }

    /**
     * Runs one gateway request, unwraps the envelope and maps transport errors.
     */
    private JsonNode call(String operation, Supplier<JsonNode> request) {
        long start = System.currentTimeMillis();
        String outcome = "error";
        try {
            JsonNode envelope = request.get();
            if (envelope == null) {
                outcome = "unavailable";
                throw new GatewayUnavailableException("Empty response from gateway for " + operation);
            }
            if (!envelope.path("requestSuccessful").asBoolean(false)) {
                outcome = "rejected";
                throw new GatewayRejectedException(
                    operation + " rejected: " + envelope.path("responseMessage").asText("no message"));
            }
            outcome = "success";
            return envelope.path("responseBody");

        } catch (HttpClientErrorException e) {
            if (e.getStatusCode().value() == HttpStatus.UNAUTHORIZED.value()) {
                invalidateToken();
                outcome = "unauthorized";
                throw new GatewayUnavailableException(operation + " unauthorized, token discarded", e);
            }
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                outcome = "not_found";
                throw new UnknownReferenceException(operation + " not found: " + e.getResponseBodyAsString());
            }
            outcome = "rejected";
            throw new GatewayRejectedException(
                operation + " rejected with HTTP " + e.getStatusCode().value() + ": " + e.getResponseBodyAsString());
        } catch (HttpServerErrorException e) {
            outcome = "unavailable";
            throw new GatewayUnavailableException(
                operation + " failed with HTTP " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            outcome = "unavailable";
            throw new GatewayUnavailableException(operation + " failed: " + e.getMessage(), e);
        } finally {
            metrics.recordGatewayCall(operation, outcome, System.currentTimeMillis() - start);
        }
    }

    private static BigDecimal decimal(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        String text = node.asText();
        return isBlank(text) ? null : new BigDecimal(text.trim());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    /**
     * The gateway does not know the reference we asked about.
     */
    private static final class UnknownReferenceException extends GatewayRejectedException {
        UnknownReferenceException(String message) {
            super(message);
        }
    }
}
