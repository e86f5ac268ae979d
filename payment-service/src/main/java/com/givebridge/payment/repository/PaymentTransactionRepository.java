package com.givebridge.payment.repository;

import com.givebridge.payment.entity.PaymentSagaStep;
import com.givebridge.payment.entity.PaymentTransaction;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Payment transactions, looked up by their public {@code transactionRef} or by donation.
 * The saga step query backs stale saga recovery.
 */
public interface PaymentTransactionRepository extends JpaRepository<PaymentTransaction, Long> {

    Optional<PaymentTransaction> findByTransactionRef(String transactionRef);

    List<PaymentTransaction> findByDonationIdOrderByCreatedAtDesc(Long donationId);

    // sagas that stopped moving, oldest first
    List<PaymentTransaction> findBySagaStepInAndUpdatedAtBeforeOrderByUpdatedAtAsc(
            Collection<PaymentSagaStep> steps, LocalDateTime updatedBefore, Pageable pageable);
}
