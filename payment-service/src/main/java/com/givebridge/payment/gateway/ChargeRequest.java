package com.givebridge.payment.gateway;

import com.givebridge.payment.entity.PaymentMethod;

import java.math.BigDecimal;

/**
 * @param idempotencyKey the payment's transaction reference
 */
public record ChargeRequest(
        BigDecimal amount,
        String currency,
        PaymentMethod method,
        PaymentDetails details,
        String idempotencyKey
) {
}
