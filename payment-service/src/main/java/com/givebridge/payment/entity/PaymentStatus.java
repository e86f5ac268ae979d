package com.givebridge.payment.entity;

/**
 * Externally visible state of a payment transaction.
 *
 * <p>PROCESSING covers the window between a successful gateway charge and the final outcome
 * (donation confirmed, or charge refunded).</p>
 */
public enum PaymentStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    REFUNDED;

    public boolean isSettled() {
        return this == COMPLETED || this == REFUNDED;
    }
}
