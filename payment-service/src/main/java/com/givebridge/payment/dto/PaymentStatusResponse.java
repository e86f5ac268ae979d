package com.givebridge.payment.dto;

import com.givebridge.payment.entity.PaymentStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * @param netSettledAmount sum of the ledger entries: payment - fee - refund
 */
public record PaymentStatusResponse(
        String transactionRef,
        PaymentStatus status,
        BigDecimal amount,
        String currency,
        String failureReason,
        LocalDateTime createdAt,
        LocalDateTime completedAt,
        BigDecimal netSettledAmount,
        List<LedgerEntryResponse> ledgerEntries
) {
}
