package com.givebridge.payment.saga;

import com.givebridge.payment.config.PaymentSagaProperties;
import com.givebridge.payment.entity.PaymentSagaStep;
import com.givebridge.payment.entity.PaymentTransaction;
import com.givebridge.payment.gateway.ChargeRequest;
import com.givebridge.payment.gateway.ChargeResult;
import com.givebridge.payment.gateway.PaymentGatewayClient;
import com.givebridge.payment.gateway.RefundResult;
import com.givebridge.payment.lock.SagaLockService;
import com.givebridge.payment.lock.SagaLockState;
import com.givebridge.payment.service.DonationConfirmationService;
import com.givebridge.payment.service.TransactionReferenceGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.BiFunction;
import java.util.function.Supplier;

/**
 * Drives one payment attempt end to end.
 *
 * <h3>Steps</h3>
 * <ol>
 *   <li>Acquire the saga lock for donation/method/amount. Contention rejects the request at once
 *       and nothing is written</li>
 *   <li>Create the PENDING transaction row</li>
 *   <li>Re-check the lock before touching money</li>
 *   <li>Charge the gateway. A decline fails the transaction and publishes PaymentFailed</li>
 *   <li>Extend the lock. A failed extension is only logged</li>
 *   <li>Write the PAYMENT and FEE ledger entries</li>
 *   <li>Confirm the donation. Confirmed completes the payment and publishes PaymentCompleted,
 *       otherwise the charge is refunded and the payment ends REFUNDED</li>
 *   <li>Release the lock, whatever happened before</li>
 * </ol>
 *
 * <p>Once the gateway has captured funds, every later failure is compensated by a refund. If the
 * refund itself is rejected the transaction ends FAILED with the refund error and is logged for
 * manual reconciliation.</p>
 *
 * <p>Each row write goes through {@link PaymentSagaRecorder}, which pairs it with its outbox
 * event in one database transaction. This class itself is not transactional: gateway and
 * donation-service calls must never run inside a database transaction.</p>
 *
 * <h3>Entry points</h3>
 * <ul>
 *   <li>{@link #start}: steps 1-2 on the caller's thread, steps 3-8 on {@code paymentSagaExecutor}</li>
 *   <li>{@link #execute}: the whole saga on the caller's thread</li>
 *   <li>{@link #recover}: finishes or fails a saga abandoned by a crashed instance</li>
 * </ul>
 */
@Slf4j
@Service
public class PaymentSagaOrchestrator {

    static final String DUPLICATE_REASON =
            "Duplicate payment detected - another payment is already in progress for this donation";
    static final String LOCK_EXPIRED_REASON = "Payment lock expired during processing";
    static final String CONFIRMATION_REFUND_REASON = "Failed to confirm donation";
    static final String CONFIRMATION_FAILED_REASON = "Failed to confirm donation - payment refunded";
    static final String POST_CHARGE_REFUND_REASON = "Payment processing failed after charge";
    static final String INTERRUPTED_REASON = "Payment saga interrupted before the gateway outcome was recorded";
    static final String CAPACITY_REASON = "Payment saga capacity exhausted, please retry";

    private final SagaLockService lockService;
    private final PaymentGatewayClient gatewayClient;
    private final PaymentSagaRecorder recorder;
    private final DonationConfirmationService donationConfirmationService;
    private final TransactionReferenceGenerator referenceGenerator;
    private final PaymentSagaProperties properties;
    private final TaskExecutor sagaExecutor;

    public PaymentSagaOrchestrator(SagaLockService lockService,
                                   PaymentGatewayClient gatewayClient,
                                   PaymentSagaRecorder recorder,
                                   DonationConfirmationService donationConfirmationService,
                                   TransactionReferenceGenerator referenceGenerator,
                                   PaymentSagaProperties properties,
                                   @Qualifier("paymentSagaExecutor") TaskExecutor sagaExecutor) {
        this.lockService = lockService;
        this.gatewayClient = gatewayClient;
        this.recorder = recorder;
        this.donationConfirmationService = donationConfirmationService;
        this.referenceGenerator = referenceGenerator;
        this.properties = properties;
        this.sagaExecutor = sagaExecutor;
    }

    /**
     * Takes the lock and writes the PENDING row, then hands the rest of the saga to the saga
     * executor.
     *
     * @return PROCESSING with the transaction reference, or an immediate failure
     */
    public PaymentSagaResult start(PaymentRequest request) {
        return begin(request, (run, ignored) -> submit(run, request));
    }

    /**
     * Runs every step on the calling thread and returns the final outcome.
     */
    public PaymentSagaResult execute(PaymentRequest request) {
        return begin(request, this::runFromLockCheck);
    }

    /**
     * Resumes a saga whose instance died, using the payment row as the checkpoint.
     *
     * <ul>
     *   <li>TRANSACTION_CREATED: whether the gateway charged is unknown and the instrument data is
     *       gone, so the payment is failed</li>
     *   <li>GATEWAY_PROCESSED: the charge is on record, so the saga continues with the ledger and
     *       donation confirmation, refunding if that fails</li>
     * </ul>
     *
     * @return empty when the saga's lock is still held or the row is already terminal
     */
    public Optional<PaymentSagaResult> recover(PaymentTransaction stale) {
        Optional<SagaLockState> acquired = lockService.acquire(stale.getSagaId(), stale.getDonationId(),
                stale.getPaymentMethod(), stale.getAmount(), properties.getLockTtl(), Duration.ZERO,
                properties.getLockRetryInterval());
        if (acquired.isEmpty()) {
            log.info("Stale saga still locked, skipping: sagaId={}, transactionRef={}",
                    stale.getSagaId(), stale.getTransactionRef());
            return Optional.empty();
        }

        SagaLockState lock = acquired.get();
        try {
            PaymentTransaction current = recorder.load(stale.getTransactionRef());
            if (current.getSagaStep().isTerminal()) {
                return Optional.empty();
            }
            log.warn("Recovering stale saga: sagaId={}, transactionRef={}, step={}",
                    current.getSagaId(), current.getTransactionRef(), current.getSagaStep());

            if (current.getSagaStep() == PaymentSagaStep.GATEWAY_PROCESSED) {
                SagaRun run = new SagaRun(current.getSagaId(), current.getTransactionRef(),
                        current.getDonationId(), current.getAmount(), lock);
                run.charge = ChargeResult.succeeded(current.getGatewayName(),
                        current.getGatewayTransactionRef(), current.getGatewayFee(), Map.of());
                return Optional.of(guarded(run, () -> settle(run)));
            }
            recorder.markFailed(current.getTransactionRef(), INTERRUPTED_REASON);
            return Optional.of(PaymentSagaResult.failed(current.getTransactionRef(), INTERRUPTED_REASON));
        } finally {
            lockService.release(lock);
        }
    }

    private PaymentSagaResult begin(PaymentRequest request,
                                    BiFunction<SagaRun, PaymentRequest, PaymentSagaResult> continuation) {
        String sagaId = UUID.randomUUID().toString();
        log.info("Saga started: sagaId={}, donationId={}, amount={} {}, method={}",
                sagaId, request.donationId(), request.amount(), request.currency(), request.method());

        // step 1
        Optional<SagaLockState> acquired = lockService.acquire(sagaId, request.donationId(), request.method(),
                request.amount(), properties.getLockTtl(), properties.getLockWait(),
                properties.getLockRetryInterval());
        if (acquired.isEmpty()) {
            log.warn("Saga rejected as duplicate: sagaId={}, donationId={}", sagaId, request.donationId());
            return PaymentSagaResult.duplicate(DUPLICATE_REASON);
        }
        SagaLockState lock = acquired.get();

        // step 2
        String transactionRef = referenceGenerator.nextTransactionRef();
        try {
            recorder.createPending(request, transactionRef, sagaId);
        } catch (RuntimeException e) {
            log.error("Could not create payment transaction: sagaId={}, donationId={}", sagaId, request.donationId(), e);
            lockService.release(lock);
            return PaymentSagaResult.failed(null, "Saga execution failed: " + e.getMessage());
        }

        SagaRun run = new SagaRun(sagaId, transactionRef, request.donationId(), request.amount(), lock);
        return continuation.apply(run, request);
    }

    private PaymentSagaResult submit(SagaRun run, PaymentRequest request) {
        try {
            sagaExecutor.execute(() -> runFromLockCheck(run, request));
            return PaymentSagaResult.accepted(run.transactionRef);
        } catch (TaskRejectedException e) {
            log.warn("Saga executor saturated: sagaId={}, transactionRef={}", run.sagaId, run.transactionRef);
            try {
                recorder.markFailed(run.transactionRef, CAPACITY_REASON);
            } catch (RuntimeException recordError) {
                log.error("Could not record rejected saga: transactionRef={}", run.transactionRef, recordError);
            } finally {
                lockService.release(run.lock);
            }
            return PaymentSagaResult.failed(run.transactionRef, CAPACITY_REASON);
        }
    }

    // steps 3-8
    private PaymentSagaResult runFromLockCheck(SagaRun run, PaymentRequest request) {
        try {
            return guarded(run, () -> chargeAndSettle(run, request));
        } finally {
            lockService.release(run.lock);
            log.info("Saga finished: sagaId={}, transactionRef={}", run.sagaId, run.transactionRef);
        }
    }

    private PaymentSagaResult chargeAndSettle(SagaRun run, PaymentRequest request) {
        if (!lockService.isValid(run.lock)) {
            recorder.markFailed(run.transactionRef, LOCK_EXPIRED_REASON);
            return PaymentSagaResult.failed(run.transactionRef, LOCK_EXPIRED_REASON);
        }

        ChargeResult charge = charge(run, request);
        if (!charge.success()) {
            recorder.recordGatewayDecline(run.transactionRef, charge);
            return PaymentSagaResult.failed(run.transactionRef, charge.failureReason());
        }
        run.charge = charge;
        recorder.recordCharge(run.transactionRef, charge);

        if (!lockService.extend(run.lock, properties.getLockExtension())) {
            log.warn("Saga lock extension failed, continuing: sagaId={}, transactionRef={}",
                    run.sagaId, run.transactionRef);
        }
        return settle(run);
    }

    // steps 6-7, entered with funds captured
    private PaymentSagaResult settle(SagaRun run) {
        try {
            recorder.writeLedgerEntries(run.transactionRef, run.charge.metadata());
        } catch (RuntimeException e) {
            log.error("Ledger write failed after charge: sagaId={}, transactionRef={}", run.sagaId, run.transactionRef, e);
            return compensate(run, POST_CHARGE_REFUND_REASON, "Ledger write failed: " + e.getMessage());
        }

        if (confirmDonation(run)) {
            recorder.complete(run.transactionRef);
            return PaymentSagaResult.completed(run.transactionRef);
        }
        log.warn("Donation not confirmed, refunding: sagaId={}, transactionRef={}, donationId={}",
                run.sagaId, run.transactionRef, run.donationId);
        return compensate(run, CONFIRMATION_REFUND_REASON, CONFIRMATION_FAILED_REASON);
    }

    private PaymentSagaResult compensate(SagaRun run, String refundReason, String failureReason) {
        run.refundAttempted = true;
        RefundResult refund;
        try {
            refund = gatewayClient.refund(run.charge.gatewayTransactionRef(), run.amount, refundReason);
        } catch (RuntimeException e) {
            refund = RefundResult.failed("Gateway error: " + e.getMessage());
        }

        if (refund.success()) {
            recorder.recordCompensation(run.transactionRef, run.charge, refund, refundReason, failureReason);
            return PaymentSagaResult.refunded(run.transactionRef, failureReason);
        }

        String reason = "Compensation refund failed: " + refund.failureReason();
        log.error("Compensation refund failed, manual reconciliation required: sagaId={}, transactionRef={}, " +
                        "gatewayRef={}, amount={}, error={}",
                run.sagaId, run.transactionRef, run.charge.gatewayTransactionRef(), run.amount, refund.failureReason());
        recorder.markFailed(run.transactionRef, reason);
        return PaymentSagaResult.failed(run.transactionRef, reason);
    }

    private ChargeResult charge(SagaRun run, PaymentRequest request) {
        ChargeRequest chargeRequest = new ChargeRequest(request.amount(), request.currency(), request.method(),
                request.details(), run.transactionRef);
        try {
            return gatewayClient.charge(chargeRequest);
        } catch (RuntimeException e) {
            log.warn("Gateway charge errored: sagaId={}, transactionRef={}, error={}",
                    run.sagaId, run.transactionRef, e.getMessage());
            return ChargeResult.declined(gatewayClient.gatewayName(request.method()), null,
                    "Gateway error: " + e.getMessage());
        }
    }

    private boolean confirmDonation(SagaRun run) {
        try {
            return donationConfirmationService.confirm(run.donationId, run.transactionRef, "Completed");
        } catch (RuntimeException e) {
            log.warn("Donation confirmation errored: transactionRef={}, error={}", run.transactionRef, e.getMessage());
            return false;
        }
    }

    /**
     * Saga boundary: an unexpected exception fails the transaction with the exception message,
     * or refunds first if money has already moved.
     */
    private PaymentSagaResult guarded(SagaRun run, Supplier<PaymentSagaResult> steps) {
        try {
            return steps.get();
        } catch (RuntimeException e) {
            String reason = "Saga execution failed: " + e.getMessage();
            log.error("Saga failed: sagaId={}, transactionRef={}", run.sagaId, run.transactionRef, e);
            try {
                if (run.charge != null && !run.refundAttempted) {
                    return compensate(run, POST_CHARGE_REFUND_REASON, reason);
                }
                recorder.markFailed(run.transactionRef, reason);
            } catch (RuntimeException recordError) {
                log.error("Could not record saga failure, left for stale saga recovery: transactionRef={}",
                        run.transactionRef, recordError);
            }
            return PaymentSagaResult.failed(run.transactionRef, reason);
        }
    }

    /** Mutable state of one saga run. */
    private static final class SagaRun {
        private final String sagaId;
        private final String transactionRef;
        private final Long donationId;
        private final BigDecimal amount;
        private final SagaLockState lock;
        private ChargeResult charge;
        private boolean refundAttempted;

        private SagaRun(String sagaId, String transactionRef, Long donationId, BigDecimal amount, SagaLockState lock) {
            this.sagaId = sagaId;
            this.transactionRef = transactionRef;
            this.donationId = donationId;
            this.amount = amount;
            this.lock = lock;
        }
    }
}
