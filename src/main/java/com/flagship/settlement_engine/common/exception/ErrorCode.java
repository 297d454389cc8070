package com.flagship.settlement_engine.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Every failure a caller can observe. Codes are stable strings so that clients
 * can tell "already checked in" apart from "wrong event" without parsing messages.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Common
    INVALID_REQUEST(ErrorCategory.INVALID_REQUEST, HttpStatus.BAD_REQUEST, "C001", "Invalid request"),
    FORBIDDEN(ErrorCategory.FORBIDDEN, HttpStatus.FORBIDDEN, "C002", "Not allowed to perform this action"),
    CONCURRENT_CHANGE(ErrorCategory.INVALID_STATE, HttpStatus.CONFLICT, "C003", "The request conflicts with a concurrent change; retry it"),
    INTERNAL_ERROR(ErrorCategory.INTERNAL, HttpStatus.INTERNAL_SERVER_ERROR, "C004", "An unexpected error occurred"),

    // Catalog
    EVENT_NOT_FOUND(ErrorCategory.NOT_FOUND, HttpStatus.NOT_FOUND, "E001", "Event not found"),
    TIER_NOT_FOUND(ErrorCategory.NOT_FOUND, HttpStatus.NOT_FOUND, "E002", "Ticket tier not found"),
    TIER_SOLD_OUT(ErrorCategory.INVALID_STATE, HttpStatus.CONFLICT, "E003", "Ticket tier is sold out"),

    // Payment
    PAYMENT_NOT_FOUND(ErrorCategory.NOT_FOUND, HttpStatus.NOT_FOUND, "P001", "Payment not found"),
    PAYMENT_AMOUNT_MISMATCH(ErrorCategory.AMOUNT_MISMATCH, HttpStatus.UNPROCESSABLE_ENTITY, "P002",
            "Amount paid does not match the expected amount; payment flagged for review"),
    PAYMENT_INVALID_STATE(ErrorCategory.INVALID_STATE, HttpStatus.CONFLICT, "P003", "Payment is not in a valid state for this operation"),

    // Ticket / check-in
    TICKET_NOT_FOUND(ErrorCategory.NOT_FOUND, HttpStatus.NOT_FOUND, "T001", "Ticket not found"),
    TICKET_EVENT_MISMATCH(ErrorCategory.INVALID_STATE, HttpStatus.CONFLICT, "T002", "Ticket does not belong to this event"),
    TICKET_ALREADY_CHECKED_IN(ErrorCategory.INVALID_STATE, HttpStatus.CONFLICT, "T003", "Ticket has already been checked in"),
    TICKET_REFUNDED(ErrorCategory.INVALID_STATE, HttpStatus.CONFLICT, "T004", "Ticket has been refunded"),
    TICKET_CANCELLED(ErrorCategory.INVALID_STATE, HttpStatus.CONFLICT, "T005", "Ticket has been cancelled"),
    TICKET_NOT_ACTIVE(ErrorCategory.INVALID_STATE, HttpStatus.CONFLICT, "T006", "Ticket is not active"),
    CHECK_IN_NOT_OPEN(ErrorCategory.INVALID_STATE, HttpStatus.CONFLICT, "T007", "Check-in has not opened for this event"),
    CHECK_IN_CLOSED(ErrorCategory.INVALID_STATE, HttpStatus.CONFLICT, "T008", "Check-in has closed for this event"),

    // Agent codes
    AGENT_CODE_NOT_FOUND(ErrorCategory.NOT_FOUND, HttpStatus.NOT_FOUND, "G001", "Agent code not found"),
    AGENT_CODE_INACTIVE(ErrorCategory.FORBIDDEN, HttpStatus.FORBIDDEN, "G002", "Agent code is inactive"),
    AGENT_CODE_EVENT_MISMATCH(ErrorCategory.FORBIDDEN, HttpStatus.FORBIDDEN, "G003", "Agent code is not valid for this event"),
    AGENT_CODE_IN_USE(ErrorCategory.INVALID_STATE, HttpStatus.CONFLICT, "G004", "Agent code has already been used and cannot be deleted"),
    AGENT_CODE_GENERATION_FAILED(ErrorCategory.INVALID_STATE, HttpStatus.SERVICE_UNAVAILABLE, "G005", "Could not generate a unique agent code"),

    // Withdrawal
    WITHDRAWAL_NOT_FOUND(ErrorCategory.NOT_FOUND, HttpStatus.NOT_FOUND, "W001", "Withdrawal not found"),
    WITHDRAWAL_INVALID_STATE(ErrorCategory.INVALID_STATE, HttpStatus.CONFLICT, "W002", "Withdrawal is not in a valid state for this operation"),
    WITHDRAWAL_ALREADY_OPEN(ErrorCategory.INVALID_STATE, HttpStatus.CONFLICT, "W003", "A withdrawal is already awaiting OTP confirmation"),
    WITHDRAWAL_AMOUNT_OUT_OF_RANGE(ErrorCategory.INVALID_REQUEST, HttpStatus.BAD_REQUEST, "W004", "Withdrawal amount is outside the allowed range"),
    INSUFFICIENT_BALANCE(ErrorCategory.INSUFFICIENT_BALANCE, HttpStatus.UNPROCESSABLE_ENTITY, "W005", "Insufficient available balance"),
    OTP_INVALID(ErrorCategory.OTP_INVALID, HttpStatus.BAD_REQUEST, "W006", "Invalid OTP"),
    OTP_EXPIRED(ErrorCategory.OTP_EXPIRED, HttpStatus.GONE, "W007", "OTP has expired"),
    OTP_ATTEMPTS_EXCEEDED(ErrorCategory.OTP_ATTEMPTS_EXCEEDED, HttpStatus.TOO_MANY_REQUESTS, "W008", "Too many invalid OTP attempts"),
    PAYOUT_ACCOUNT_MISSING(ErrorCategory.INVALID_STATE, HttpStatus.CONFLICT, "W009", "No payout account registered"),

    // Refund
    REFUND_NOT_FOUND(ErrorCategory.NOT_FOUND, HttpStatus.NOT_FOUND, "R001", "Refund request not found"),
    REFUND_INVALID_STATE(ErrorCategory.INVALID_STATE, HttpStatus.CONFLICT, "R002", "Refund request is not in a valid state for this operation"),
    REFUND_ALREADY_REQUESTED(ErrorCategory.INVALID_STATE, HttpStatus.CONFLICT, "R003", "A refund has already been requested for this ticket"),
    REFUND_NOT_ENABLED(ErrorCategory.INVALID_STATE, HttpStatus.CONFLICT, "R004", "Refunds are not enabled for this ticket tier"),
    REFUND_WINDOW_CLOSED(ErrorCategory.INVALID_STATE, HttpStatus.CONFLICT, "R005", "Refunds are closed once the event has started"),
    REJECTION_NOTE_REQUIRED(ErrorCategory.INVALID_REQUEST, HttpStatus.BAD_REQUEST, "R006", "A rejection note is required"),

    // Ledger
    LEDGER_SALE_NOT_FOUND(ErrorCategory.NOT_FOUND, HttpStatus.NOT_FOUND, "L001", "No sale recorded for this ticket"),
    LEDGER_ALREADY_REVERSED(ErrorCategory.INVALID_STATE, HttpStatus.CONFLICT, "L002", "Sale has already been refunded or charged back"),

    // Gateway
    GATEWAY_UNAVAILABLE(ErrorCategory.GATEWAY_UNAVAILABLE, HttpStatus.SERVICE_UNAVAILABLE, "X001", "Payment gateway is unavailable"),
    GATEWAY_REJECTED(ErrorCategory.GATEWAY_REJECTED, HttpStatus.BAD_GATEWAY, "X002", "Payment gateway rejected the request");

    private final ErrorCategory category;
    private final HttpStatus status;
    private final String code;
    private final String message;
}
