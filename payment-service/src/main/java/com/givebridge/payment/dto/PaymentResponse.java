package com.givebridge.payment.dto;

import com.givebridge.payment.entity.PaymentMethod;
import com.givebridge.payment.entity.PaymentStatus;
import com.givebridge.payment.entity.PaymentTransaction;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record PaymentResponse(
        String transactionRef,
        Long donationId,
        Long campaignId,
        BigDecimal amount,
        String currency,
        PaymentStatus status,
        PaymentMethod paymentMethod,
        String gatewayName,
        String gatewayTransactionRef,
        BigDecimal refundedAmount,
        String failureReason,
        LocalDateTime createdAt,
        LocalDateTime processedAt,
        LocalDateTime completedAt
) {
    public static PaymentResponse from(PaymentTransaction transaction) {
        return new PaymentResponse(
                transaction.getTransactionRef(),
                transaction.getDonationId(),
                transaction.getCampaignId(),
                transaction.getAmount(),
                transaction.getCurrency(),
                transaction.getStatus(),
                transaction.getPaymentMethod(),
                transaction.getGatewayName(),
                transaction.getGatewayTransactionRef(),
                transaction.getRefundedAmount(),
                transaction.getFailureReason(),
                transaction.getCreatedAt(),
                transaction.getProcessedAt(),
                transaction.getCompletedAt());
    }
}
