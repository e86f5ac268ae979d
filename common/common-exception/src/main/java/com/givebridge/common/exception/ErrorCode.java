package com.givebridge.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Error codes shared by the GiveBridge services.
 *
 * <h3>Groups</h3>
 * <ul>
 *   <li><b>Common</b>: malformed input, missing entities, unavailable dependencies</li>
 *   <li><b>Traffic control</b>: Resilience4j rate limiter, bulkhead and circuit breaker rejections</li>
 *   <li><b>Payment</b>: saga, refund and lock failures</li>
 * </ul>
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // ── Common ──
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "Invalid input value"),
    ENTITY_NOT_FOUND(HttpStatus.NOT_FOUND, "Entity not found"),
    SERVICE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "Service temporarily unavailable"),

    // ── Traffic control (Resilience4j) ──
    RATE_LIMIT_EXCEEDED(HttpStatus.TOO_MANY_REQUESTS, "Rate limit exceeded. Please try again later"),
    BULKHEAD_FULL(HttpStatus.SERVICE_UNAVAILABLE, "Too many concurrent requests. Please try again later"),
    CIRCUIT_BREAKER_OPEN(HttpStatus.SERVICE_UNAVAILABLE, "Service circuit breaker is open"),
    REQUEST_TIMEOUT(HttpStatus.GATEWAY_TIMEOUT, "Request timed out"),

    // ── Payment ──
    PAYMENT_NOT_FOUND(HttpStatus.NOT_FOUND, "Payment not found"),
    // another saga holds the lock for the same donation/method/amount
    DUPLICATE_PAYMENT_IN_PROGRESS(HttpStatus.CONFLICT,
            "Duplicate payment detected - another payment is already in progress for this donation"),
    INVALID_PAYMENT_STATUS(HttpStatus.BAD_REQUEST, "Invalid payment status for this operation"),
    INVALID_REFUND_AMOUNT(HttpStatus.BAD_REQUEST, "Invalid refund amount"),
    REFUND_FAILED(HttpStatus.BAD_GATEWAY, "Refund was rejected by the payment gateway"),
    LOCK_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "Payment lock could not be obtained");

    private final HttpStatus status;
    private final String message;
}
