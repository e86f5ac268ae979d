package com.givebridge.common.event;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Published for both saga compensation refunds and operator-initiated refunds.
 */
public record PaymentRefundedEvent(
        String eventId,
        String refundRef,
        String originalTransactionRef,
        Long donationId,
        Long campaignId,
        BigDecimal refundAmount,
        String reason,
        LocalDateTime refundedAt
) {
    public PaymentRefundedEvent(String refundRef, String originalTransactionRef, Long donationId,
                                Long campaignId, BigDecimal refundAmount, String reason,
                                LocalDateTime refundedAt) {
        this(UUID.randomUUID().toString(), refundRef, originalTransactionRef, donationId, campaignId,
                refundAmount, reason, refundedAt);
    }
}
