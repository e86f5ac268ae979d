package com.givebridge.payment.repository;

import com.givebridge.payment.entity.PaymentLedgerEntry;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * Append-only ledger lines. Entries are never updated or deleted; {@code reference} is unique,
 * so {@link #existsByReference} guards against booking the same movement twice.
 */
public interface PaymentLedgerEntryRepository extends JpaRepository<PaymentLedgerEntry, Long> {

    List<PaymentLedgerEntry> findByTransactionIdOrderByIdAsc(Long transactionId);

    boolean existsByReference(String reference);
}
