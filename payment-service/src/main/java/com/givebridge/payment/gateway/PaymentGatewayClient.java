package com.givebridge.payment.gateway;

import com.givebridge.payment.entity.PaymentMethod;

import java.math.BigDecimal;

/**
 * Remote payment processor.
 *
 * <p>Both calls are slow and fallible. Declines come back as unsuccessful results; transport or
 * processor errors may also surface as runtime exceptions, and callers handle both.
 * {@link ChargeRequest#idempotencyKey()} lets the processor recognise a repeated charge.</p>
 */
public interface PaymentGatewayClient {

    ChargeResult charge(ChargeRequest request);

    RefundResult refund(String gatewayTransactionRef, BigDecimal amount, String reason);

    /** Display name of the processor that handles {@code method}, e.g. "Stripe". */
    String gatewayName(PaymentMethod method);
}
