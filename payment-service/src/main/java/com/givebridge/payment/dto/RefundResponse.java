package com.givebridge.payment.dto;

import com.givebridge.payment.entity.PaymentStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record RefundResponse(
        String refundRef,
        String originalTransactionRef,
        BigDecimal refundAmount,
        PaymentStatus status,
        LocalDateTime refundedAt
) {
}
