package com.givebridge.payment.saga;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.givebridge.common.event.PaymentCompletedEvent;
import com.givebridge.common.event.PaymentFailedEvent;
import com.givebridge.common.event.PaymentRefundedEvent;
import com.givebridge.common.exception.BusinessException;
import com.givebridge.common.exception.ErrorCode;
import com.givebridge.common.outbox.OutboxService;
import com.givebridge.payment.entity.LedgerEntryType;
import com.givebridge.payment.entity.LedgerOperation;
import com.givebridge.payment.entity.PaymentLedgerEntry;
import com.givebridge.payment.entity.PaymentTransaction;
import com.givebridge.payment.gateway.ChargeResult;
import com.givebridge.payment.gateway.RefundResult;
import com.givebridge.payment.repository.PaymentLedgerEntryRepository;
import com.givebridge.payment.repository.PaymentTransactionRepository;
import com.givebridge.payment.service.TransactionReferenceGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * The saga's local transactions.
 *
 * <p>Each method is one database transaction that changes the payment row, appends ledger
 * entries where needed and writes the matching outbox event, so the event commits if and only
 * if the state it describes commits. Gateway and donation-service calls never happen in here.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentSagaRecorder {

    public static final String AGGREGATE_TYPE = "PaymentTransaction";

    private final PaymentTransactionRepository transactionRepository;
    private final PaymentLedgerEntryRepository ledgerEntryRepository;
    private final OutboxService outboxService;
    private final TransactionReferenceGenerator referenceGenerator;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Transactional
    public PaymentTransaction createPending(PaymentRequest request, String transactionRef, String sagaId) {
        PaymentTransaction transaction = transactionRepository.save(PaymentTransaction.builder()
                .transactionRef(transactionRef)
                .donationId(request.donationId())
                .campaignId(request.campaignId())
                .amount(request.amount())
                .currency(request.currency())
                .donorName(request.donorName())
                .donorEmail(request.donorEmail())
                .paymentMethod(request.method())
                .sagaId(sagaId)
                .build());
        log.info("Saga step: sagaId={}, transactionRef={}, step={}",
                sagaId, transactionRef, transaction.getSagaStep());
        return transaction;
    }

    @Transactional(readOnly = true)
    public PaymentTransaction load(String transactionRef) {
        return get(transactionRef);
    }

    @Transactional
    public PaymentTransaction recordGatewayDecline(String transactionRef, ChargeResult charge) {
        PaymentTransaction transaction = get(transactionRef);
        transaction.recordGatewayDecline(charge.gatewayName(), charge.gatewayTransactionRef(),
                charge.failureReason(), now());
        publishFailed(transaction);
        log.info("Saga step: sagaId={}, transactionRef={}, step={}, reason={}",
                transaction.getSagaId(), transactionRef, transaction.getSagaStep(), charge.failureReason());
        return transaction;
    }

    @Transactional
    public PaymentTransaction recordCharge(String transactionRef, ChargeResult charge) {
        PaymentTransaction transaction = get(transactionRef);
        transaction.recordCharge(charge.gatewayName(), charge.gatewayTransactionRef(), charge.fee(), now());
        log.info("Saga step: sagaId={}, transactionRef={}, step={}, gatewayRef={}",
                transaction.getSagaId(), transactionRef, transaction.getSagaStep(), charge.gatewayTransactionRef());
        return transaction;
    }

    /**
     * PAYMENT debit for the gross amount and FEE debit for the gateway fee. Skipped when the
     * entries already exist, which happens when a recovered saga is resumed.
     */
    @Transactional
    public void writeLedgerEntries(String transactionRef, Map<String, String> metadata) {
        PaymentTransaction transaction = get(transactionRef);
        if (ledgerEntryRepository.existsByReference(transactionRef)) {
            log.info("Ledger entries already present: transactionRef={}", transactionRef);
            return;
        }
        LocalDateTime now = now();
        BigDecimal fee = transaction.getGatewayFee() != null ? transaction.getGatewayFee() : BigDecimal.ZERO;

        ledgerEntryRepository.save(PaymentLedgerEntry.builder()
                .transaction(transaction)
                .reference(transactionRef)
                .amount(transaction.getAmount())
                .entryType(LedgerEntryType.PAYMENT)
                .operation(LedgerOperation.DEBIT)
                .description("Donation payment via " + transaction.getGatewayName())
                .metadata(metadata == null || metadata.isEmpty() ? null : toJson(metadata))
                .createdAt(now)
                .build());
        ledgerEntryRepository.save(PaymentLedgerEntry.builder()
                .transaction(transaction)
                .reference(transactionRef + "-FEE")
                .amount(fee)
                .entryType(LedgerEntryType.FEE)
                .operation(LedgerOperation.DEBIT)
                .description(transaction.getGatewayName() + " processing fee")
                .createdAt(now)
                .build());
        log.info("Ledger entries written: transactionRef={}, amount={}, fee={}",
                transactionRef, transaction.getAmount(), fee);
    }

    @Transactional
    public PaymentTransaction complete(String transactionRef) {
        PaymentTransaction transaction = get(transactionRef);
        transaction.complete(now());
        outboxService.saveEvent(AGGREGATE_TYPE, transactionRef, "PaymentCompleted",
                new PaymentCompletedEvent(transactionRef, transaction.getDonationId(),
                        transaction.getCampaignId(), transaction.getAmount(), transaction.getCurrency(),
                        transaction.getPaymentMethod().name(), transaction.getDonorName(),
                        transaction.getDonorEmail(), transaction.getCompletedAt(),
                        transaction.getGatewayTransactionRef()));
        log.info("Saga step: sagaId={}, transactionRef={}, step={}",
                transaction.getSagaId(), transactionRef, transaction.getSagaStep());
        return transaction;
    }

    /**
     * Saga compensation: REFUND credit entry, status REFUNDED and a PaymentRefunded event.
     * {@code charge} restores the gateway data if the saga failed before it could be recorded.
     */
    @Transactional
    public PaymentTransaction recordCompensation(String transactionRef, ChargeResult charge, RefundResult refund,
                                                 String refundReason, String failureReason) {
        PaymentTransaction transaction = get(transactionRef);
        if (!transaction.isCharged()) {
            transaction.recordCharge(charge.gatewayName(), charge.gatewayTransactionRef(), charge.fee(), now());
        }
        transaction.compensate(refund.refundedAmount(), failureReason, now());
        writeRefund(transaction, referenceGenerator.nextRefundRef(), refund, refundReason);
        log.info("Saga step: sagaId={}, transactionRef={}, step={}, refundRef={}",
                transaction.getSagaId(), transactionRef, transaction.getSagaStep(), refund.refundRef());
        return transaction;
    }

    /**
     * Refund of an already completed payment, full or partial.
     */
    @Transactional
    public PaymentTransaction recordRefund(String transactionRef, String refundRef, RefundResult refund,
                                           String reason) {
        PaymentTransaction transaction = get(transactionRef);
        transaction.refund(refund.refundedAmount(), now());
        writeRefund(transaction, refundRef, refund, reason);
        log.info("Payment refunded: transactionRef={}, amount={}, gatewayRefundRef={}",
                transactionRef, refund.refundedAmount(), refund.refundRef());
        return transaction;
    }

    @Transactional
    public PaymentTransaction markFailed(String transactionRef, String reason) {
        PaymentTransaction transaction = get(transactionRef);
        transaction.fail(reason);
        publishFailed(transaction);
        log.info("Saga step: sagaId={}, transactionRef={}, step={}, reason={}",
                transaction.getSagaId(), transactionRef, transaction.getSagaStep(), reason);
        return transaction;
    }

    private void writeRefund(PaymentTransaction transaction, String refundRef, RefundResult refund, String reason) {
        LocalDateTime now = now();
        String transactionRef = transaction.getTransactionRef();
        ledgerEntryRepository.save(PaymentLedgerEntry.builder()
                .transaction(transaction)
                .reference(transactionRef + "-REFUND")
                .amount(refund.refundedAmount())
                .entryType(LedgerEntryType.REFUND)
                .operation(LedgerOperation.CREDIT)
                .description("Refund: " + reason)
                .metadata(toJson(Map.of("gateway_refund_ref", String.valueOf(refund.refundRef()))))
                .createdAt(now)
                .build());
        outboxService.saveEvent(AGGREGATE_TYPE, transactionRef, "PaymentRefunded",
                new PaymentRefundedEvent(refundRef, transactionRef,
                        transaction.getDonationId(), transaction.getCampaignId(),
                        refund.refundedAmount(), reason, now));
    }

    private void publishFailed(PaymentTransaction transaction) {
        outboxService.saveEvent(AGGREGATE_TYPE, transaction.getTransactionRef(), "PaymentFailed",
                new PaymentFailedEvent(transaction.getTransactionRef(), transaction.getDonationId(),
                        transaction.getCampaignId(), transaction.getAmount(), transaction.getCurrency(),
                        transaction.getPaymentMethod().name(), transaction.getDonorName(),
                        transaction.getDonorEmail(), transaction.getFailureReason(), now()));
    }

    private PaymentTransaction get(String transactionRef) {
        return transactionRepository.findByTransactionRef(transactionRef)
                .orElseThrow(() -> new BusinessException(ErrorCode.PAYMENT_NOT_FOUND,
                        "Payment not found: " + transactionRef));
    }

    private String toJson(Map<String, String> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize ledger metadata", e);
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
