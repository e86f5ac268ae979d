package com.givebridge.payment.dto;

import com.givebridge.payment.entity.LedgerEntryType;
import com.givebridge.payment.entity.LedgerOperation;
import com.givebridge.payment.entity.PaymentLedgerEntry;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record LedgerEntryResponse(
        String reference,
        BigDecimal amount,
        LedgerEntryType entryType,
        LedgerOperation operation,
        String description,
        LocalDateTime createdAt
) {
    public static LedgerEntryResponse from(PaymentLedgerEntry entry) {
        return new LedgerEntryResponse(entry.getReference(), entry.getAmount(), entry.getEntryType(),
                entry.getOperation(), entry.getDescription(), entry.getCreatedAt());
    }
}
