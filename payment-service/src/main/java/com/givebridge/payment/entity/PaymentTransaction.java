package com.givebridge.payment.entity;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * One payment attempt for one donation.
 *
 * <h3>Invariants</h3>
 * <ul>
 *   <li>{@code completedAt} is set exactly when the status is COMPLETED or REFUNDED</li>
 *   <li>{@code gatewayTransactionRef} is set only once the gateway has been called</li>
 *   <li>Rows are never deleted</li>
 * </ul>
 *
 * <p>Only the saga (and the refund operation for already completed payments) mutates a row.
 * {@code sagaStep} must follow {@link PaymentSagaStep#canTransitionTo}.</p>
 */
@Entity
@Table(name = "payment_transactions", indexes = {
        @Index(name = "idx_payment_tx_donation", columnList = "donationId"),
        @Index(name = "idx_payment_tx_saga_step", columnList = "sagaStep, updatedAt")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class PaymentTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "payment_tx_seq")
    @SequenceGenerator(name = "payment_tx_seq", sequenceName = "payment_tx_seq", allocationSize = 50)
    private Long id;

    @Version
    private Long version;

    @Column(nullable = false, unique = true, length = 40)
    private String transactionRef;

    @Column(nullable = false)
    private Long donationId;

    @Column(nullable = false)
    private Long campaignId;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(nullable = false, length = 100)
    private String donorName;

    @Column(nullable = false, length = 200)
    private String donorEmail;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentMethod paymentMethod;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentStatus status;

    @Column(nullable = false, length = 36)
    private String sagaId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private PaymentSagaStep sagaStep;

    @Column(length = 50)
    private String gatewayName;

    @Column(length = 100)
    private String gatewayTransactionRef;

    @Column(precision = 19, scale = 2)
    private BigDecimal gatewayFee;

    @Column(precision = 19, scale = 2)
    private BigDecimal refundedAmount;

    @Column(length = 1000)
    private String failureReason;

    @CreatedDate
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @LastModifiedDate
    private LocalDateTime updatedAt;

    private LocalDateTime processedAt;

    private LocalDateTime completedAt;

    @Builder
    public PaymentTransaction(String transactionRef, Long donationId, Long campaignId,
                              BigDecimal amount, String currency, String donorName,
                              String donorEmail, PaymentMethod paymentMethod, String sagaId) {
        this.transactionRef = transactionRef;
        this.donationId = donationId;
        this.campaignId = campaignId;
        this.amount = amount;
        this.currency = currency;
        this.donorName = donorName;
        this.donorEmail = donorEmail;
        this.paymentMethod = paymentMethod;
        this.sagaId = sagaId;
        this.status = PaymentStatus.PENDING;
        // lock already held when the row is written
        this.sagaStep = PaymentSagaStep.TRANSACTION_CREATED;
    }

    /** The gateway captured the funds; the final outcome is still open. */
    public void recordCharge(String gatewayName, String gatewayTransactionRef,
                             BigDecimal gatewayFee, LocalDateTime processedAt) {
        advanceTo(PaymentSagaStep.GATEWAY_PROCESSED);
        this.status = PaymentStatus.PROCESSING;
        this.gatewayName = gatewayName;
        this.gatewayTransactionRef = gatewayTransactionRef;
        this.gatewayFee = gatewayFee;
        this.processedAt = processedAt;
    }

    public void recordGatewayDecline(String gatewayName, String gatewayTransactionRef,
                                     String reason, LocalDateTime processedAt) {
        advanceTo(PaymentSagaStep.FAILED);
        this.status = PaymentStatus.FAILED;
        this.gatewayName = gatewayName;
        this.gatewayTransactionRef = gatewayTransactionRef;
        this.failureReason = reason;
        this.processedAt = processedAt;
    }

    public void complete(LocalDateTime completedAt) {
        advanceTo(PaymentSagaStep.COMPLETED);
        this.status = PaymentStatus.COMPLETED;
        this.completedAt = completedAt;
    }

    /** Charge reversed by the saga itself after a failure downstream of the gateway. */
    public void compensate(BigDecimal refundedAmount, String reason, LocalDateTime completedAt) {
        advanceTo(PaymentSagaStep.REFUNDED);
        this.status = PaymentStatus.REFUNDED;
        this.refundedAmount = refundedAmount;
        this.failureReason = reason;
        this.completedAt = completedAt;
    }

    /**
     * Operator or donor initiated refund of a completed payment. The saga has already finished,
     * so {@code sagaStep} stays COMPLETED.
     */
    public void refund(BigDecimal refundedAmount, LocalDateTime refundedAt) {
        if (status != PaymentStatus.COMPLETED) {
            throw new IllegalStateException("Only completed payments can be refunded: " + transactionRef);
        }
        this.status = PaymentStatus.REFUNDED;
        this.refundedAmount = refundedAmount;
        this.completedAt = refundedAt;
    }

    public void fail(String reason) {
        advanceTo(PaymentSagaStep.FAILED);
        this.status = PaymentStatus.FAILED;
        this.failureReason = reason;
        this.completedAt = null;
    }

    public boolean isCharged() {
        return sagaStep == PaymentSagaStep.GATEWAY_PROCESSED;
    }

    private void advanceTo(PaymentSagaStep next) {
        if (!sagaStep.canTransitionTo(next)) {
            throw new IllegalStateException("Invalid saga transition " + sagaStep + " -> " + next
                    + " for " + transactionRef);
        }
        this.sagaStep = next;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PaymentTransaction that)) return false;
        return id != null && id.equals(that.getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
