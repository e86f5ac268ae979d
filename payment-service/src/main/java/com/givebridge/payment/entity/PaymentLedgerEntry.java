package com.givebridge.payment.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Immutable record of one money movement on a payment transaction.
 *
 * <p>A completed payment carries a PAYMENT debit for the gross amount and a FEE debit for the
 * gateway fee; a refunded one additionally carries a REFUND credit. Entry references are
 * {@code <txnRef>}, {@code <txnRef>-FEE} and {@code <txnRef>-REFUND}, so each kind is written at
 * most once per transaction.</p>
 */
@Entity
@Table(name = "payment_ledger_entries", indexes = {
        @Index(name = "idx_ledger_transaction", columnList = "payment_transaction_id")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PaymentLedgerEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "payment_transaction_id", nullable = false, updatable = false)
    private PaymentTransaction transaction;

    @Column(nullable = false, unique = true, updatable = false, length = 60)
    private String reference;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, updatable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private LedgerEntryType entryType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 10)
    private LedgerOperation operation;

    @Column(nullable = false, updatable = false, length = 500)
    private String description;

    // JSON, e.g. {"gateway":"Stripe","last4":"4242","auth_code":"123456"}
    @Column(updatable = false, columnDefinition = "TEXT")
    private String metadata;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Builder
    public PaymentLedgerEntry(PaymentTransaction transaction, String reference, BigDecimal amount,
                              LedgerEntryType entryType, LedgerOperation operation,
                              String description, String metadata, LocalDateTime createdAt) {
        this.transaction = transaction;
        this.reference = reference;
        this.amount = amount;
        this.currency = transaction.getCurrency();
        this.entryType = entryType;
        this.operation = operation;
        this.description = description;
        this.metadata = metadata;
        this.createdAt = createdAt;
    }

    /**
     * Effect on the net settled amount. PAYMENT adds, FEE, REFUND and CHARGEBACK subtract, and an
     * ADJUSTMENT follows its operation.
     */
    public BigDecimal signedAmount() {
        return switch (entryType) {
            case PAYMENT -> amount;
            case ADJUSTMENT -> operation == LedgerOperation.DEBIT ? amount : amount.negate();
            default -> amount.negate();
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PaymentLedgerEntry that)) return false;
        return id != null && id.equals(that.getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
