package com.givebridge.common.event;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Published once a charge has been captured and the donation confirmed.
 *
 * <p>Delivery is at-least-once, so consumers de-duplicate on {@code eventId}.</p>
 */
public record PaymentCompletedEvent(
        String eventId,
        String transactionRef,
        Long donationId,
        Long campaignId,
        BigDecimal amount,
        String currency,
        String paymentMethod,
        String donorName,
        String donorEmail,
        LocalDateTime completedAt,
        String gatewayTransactionRef
) {
    public PaymentCompletedEvent(String transactionRef, Long donationId, Long campaignId,
                                 BigDecimal amount, String currency, String paymentMethod,
                                 String donorName, String donorEmail,
                                 LocalDateTime completedAt, String gatewayTransactionRef) {
        this(UUID.randomUUID().toString(), transactionRef, donationId, campaignId, amount, currency,
                paymentMethod, donorName, donorEmail, completedAt, gatewayTransactionRef);
    }
}
