package com.givebridge.common.event;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Published when a payment attempt ends without money moving (declined charge, stale saga).
 */
public record PaymentFailedEvent(
        String eventId,
        String transactionRef,
        Long donationId,
        Long campaignId,
        BigDecimal amount,
        String currency,
        String paymentMethod,
        String donorName,
        String donorEmail,
        String failureReason,
        LocalDateTime failedAt
) {
    public PaymentFailedEvent(String transactionRef, Long donationId, Long campaignId,
                              BigDecimal amount, String currency, String paymentMethod,
                              String donorName, String donorEmail,
                              String failureReason, LocalDateTime failedAt) {
        this(UUID.randomUUID().toString(), transactionRef, donationId, campaignId, amount, currency,
                paymentMethod, donorName, donorEmail, failureReason, failedAt);
    }
}
