package com.givebridge.payment.saga;

import com.givebridge.payment.entity.PaymentStatus;

/**
 * What a saga run reports back.
 *
 * <p>{@code transactionRef} is null only when no transaction row was written, i.e. the request was
 * rejected as a duplicate or the row could not be created.</p>
 */
public record PaymentSagaResult(
        String transactionRef,
        PaymentStatus status,
        String failureReason,
        boolean duplicate
) {
    public static PaymentSagaResult accepted(String transactionRef) {
        return new PaymentSagaResult(transactionRef, PaymentStatus.PROCESSING, null, false);
    }

    public static PaymentSagaResult completed(String transactionRef) {
        return new PaymentSagaResult(transactionRef, PaymentStatus.COMPLETED, null, false);
    }

    public static PaymentSagaResult refunded(String transactionRef, String failureReason) {
        return new PaymentSagaResult(transactionRef, PaymentStatus.REFUNDED, failureReason, false);
    }

    public static PaymentSagaResult failed(String transactionRef, String failureReason) {
        return new PaymentSagaResult(transactionRef, PaymentStatus.FAILED, failureReason, false);
    }

    public static PaymentSagaResult duplicate(String failureReason) {
        return new PaymentSagaResult(null, PaymentStatus.FAILED, failureReason, true);
    }

    public boolean isAccepted() {
        return status == PaymentStatus.PROCESSING;
    }
}
