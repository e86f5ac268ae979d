package com.givebridge.payment.service;

import com.givebridge.common.exception.BusinessException;
import com.givebridge.common.exception.ErrorCode;
import com.givebridge.payment.config.PaymentSagaProperties;
import com.givebridge.payment.dto.LedgerEntryResponse;
import com.givebridge.payment.dto.PaymentAcceptedResponse;
import com.givebridge.payment.dto.PaymentResponse;
import com.givebridge.payment.dto.PaymentStatusResponse;
import com.givebridge.payment.dto.RefundResponse;
import com.givebridge.payment.dto.ServiceInfoResponse;
import com.givebridge.payment.entity.PaymentLedgerEntry;
import com.givebridge.payment.entity.PaymentStatus;
import com.givebridge.payment.entity.PaymentTransaction;
import com.givebridge.payment.gateway.PaymentGatewayClient;
import com.givebridge.payment.gateway.RefundResult;
import com.givebridge.payment.lock.SagaLockService;
import com.givebridge.payment.lock.SagaLockState;
import com.givebridge.payment.repository.PaymentLedgerEntryRepository;
import com.givebridge.payment.repository.PaymentTransactionRepository;
import com.givebridge.payment.saga.PaymentRequest;
import com.givebridge.payment.saga.PaymentSagaOrchestrator;
import com.givebridge.payment.saga.PaymentSagaRecorder;
import com.givebridge.payment.saga.PaymentSagaResult;
import io.github.resilience4j.bulkhead.annotation.Bulkhead;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * REST-facing payment operations.
 *
 * <p>Payment creation and refunds call the gateway, so they run without a surrounding database
 * transaction ({@link Propagation#NOT_SUPPORTED}); their writes are committed step by step by
 * {@link PaymentSagaRecorder}. Reads share the class-level read-only transaction.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class PaymentService {

    private static final String DEFAULT_REFUND_REASON = "Refund requested";

    private final PaymentSagaOrchestrator orchestrator;
    private final PaymentSagaRecorder recorder;
    private final SagaLockService lockService;
    private final PaymentGatewayClient gatewayClient;
    private final PaymentTransactionRepository transactionRepository;
    private final PaymentLedgerEntryRepository ledgerEntryRepository;
    private final TransactionReferenceGenerator referenceGenerator;
    private final PaymentSagaProperties sagaProperties;
    private final Clock clock;

    /**
     * Starts a payment saga. The saga continues in the background; poll
     * {@link #getPayment(String)} for the outcome.
     *
     * @throws BusinessException DUPLICATE_PAYMENT_IN_PROGRESS when an identical payment holds the lock
     */
    @Bulkhead(name = "paymentSaga")
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public PaymentAcceptedResponse processPayment(PaymentRequest request) {
        PaymentSagaResult result = orchestrator.start(request);
        if (result.duplicate()) {
            throw new BusinessException(ErrorCode.DUPLICATE_PAYMENT_IN_PROGRESS);
        }
        if (!result.isAccepted()) {
            throw new BusinessException(ErrorCode.SERVICE_UNAVAILABLE, result.failureReason());
        }
        return new PaymentAcceptedResponse(result.transactionRef(), result.status());
    }

    public PaymentStatusResponse getPayment(String transactionRef) {
        PaymentTransaction transaction = findTransaction(transactionRef);
        List<PaymentLedgerEntry> entries = ledgerEntryRepository.findByTransactionIdOrderByIdAsc(transaction.getId());
        BigDecimal net = entries.stream()
                .map(PaymentLedgerEntry::signedAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        return new PaymentStatusResponse(
                transaction.getTransactionRef(),
                transaction.getStatus(),
                transaction.getAmount(),
                transaction.getCurrency(),
                transaction.getFailureReason(),
                transaction.getCreatedAt(),
                transaction.getCompletedAt(),
                net,
                entries.stream().map(LedgerEntryResponse::from).toList());
    }

    public List<PaymentResponse> getPaymentsByDonation(Long donationId) {
        return transactionRepository.findByDonationIdOrderByCreatedAtDesc(donationId).stream()
                .map(PaymentResponse::from)
                .toList();
    }

    /**
     * Refunds a completed payment, in full when {@code amount} is null.
     *
     * <p>Runs under the payment's saga lock key so it cannot overlap a saga for the same
     * donation, method and amount.</p>
     */
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public RefundResponse refund(String transactionRef, BigDecimal amount, String reason) {
        PaymentTransaction transaction = findTransaction(transactionRef);
        BigDecimal refundAmount = validateRefund(transaction, amount);
        String refundReason = reason == null || reason.isBlank() ? DEFAULT_REFUND_REASON : reason;

        String lockOwner = "refund-" + UUID.randomUUID();
        SagaLockState lock = lockService.acquire(lockOwner, transaction.getDonationId(),
                        transaction.getPaymentMethod(), transaction.getAmount(), sagaProperties.getLockTtl(),
                        sagaProperties.getLockWait(), sagaProperties.getLockRetryInterval())
                .orElseThrow(() -> new BusinessException(ErrorCode.LOCK_UNAVAILABLE));
        try {
            // status may have moved while we waited for the lock
            PaymentTransaction current = recorder.load(transactionRef);
            validateRefund(current, refundAmount);

            RefundResult refund = callGatewayRefund(current, refundAmount, refundReason);
            if (!refund.success()) {
                log.warn("Refund rejected by gateway: transactionRef={}, amount={}, reason={}",
                        transactionRef, refundAmount, refund.failureReason());
                throw new BusinessException(ErrorCode.REFUND_FAILED,
                        "Refund failed: " + refund.failureReason());
            }

            String refundRef = referenceGenerator.nextRefundRef();
            PaymentTransaction refunded = recorder.recordRefund(transactionRef, refundRef, refund, refundReason);
            return new RefundResponse(refundRef, transactionRef, refund.refundedAmount(),
                    refunded.getStatus(), LocalDateTime.now(clock));
        } finally {
            lockService.release(lock);
        }
    }

    public ServiceInfoResponse serviceInfo() {
        return new ServiceInfoResponse(
                "payment-service",
                "0.1.0",
                "Donation payment processing with saga orchestration",
                List.of("Payment saga orchestration", "Distributed saga locks",
                        "Transactional outbox", "Payment ledger", "Refunds"),
                LocalDateTime.now(clock));
    }

    private RefundResult callGatewayRefund(PaymentTransaction transaction, BigDecimal amount, String reason) {
        try {
            return gatewayClient.refund(transaction.getGatewayTransactionRef(), amount, reason);
        } catch (RuntimeException e) {
            log.error("Refund call failed: transactionRef={}", transaction.getTransactionRef(), e);
            return RefundResult.failed("Gateway error: " + e.getMessage());
        }
    }

    private BigDecimal validateRefund(PaymentTransaction transaction, BigDecimal amount) {
        if (transaction.getStatus() != PaymentStatus.COMPLETED) {
            throw new BusinessException(ErrorCode.INVALID_PAYMENT_STATUS,
                    "Only completed payments can be refunded, status is " + transaction.getStatus());
        }
        BigDecimal refundAmount = amount != null ? amount : transaction.getAmount();
        if (refundAmount.signum() <= 0 || refundAmount.compareTo(transaction.getAmount()) > 0) {
            throw new BusinessException(ErrorCode.INVALID_REFUND_AMOUNT,
                    "Refund amount must be greater than 0 and at most " + transaction.getAmount());
        }
        return refundAmount;
    }

    private PaymentTransaction findTransaction(String transactionRef) {
        return transactionRepository.findByTransactionRef(transactionRef)
                .orElseThrow(() -> new BusinessException(ErrorCode.PAYMENT_NOT_FOUND,
                        "Payment not found: " + transactionRef));
    }
}
