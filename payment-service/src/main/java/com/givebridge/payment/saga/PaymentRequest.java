package com.givebridge.payment.saga;

import com.givebridge.payment.entity.PaymentMethod;
import com.givebridge.payment.gateway.PaymentDetails;

import java.math.BigDecimal;

/**
 * Input of one payment saga.
 */
public record PaymentRequest(
        Long donationId,
        Long campaignId,
        BigDecimal amount,
        String currency,
        String donorName,
        String donorEmail,
        PaymentMethod method,
        PaymentDetails details
) {
}
