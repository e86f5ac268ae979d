package com.givebridge.payment.entity;

import java.util.Set;

/**
 * Steps of the payment saga and the transitions allowed between them.
 *
 * <pre>
 *   INITIATED → LOCK_ACQUIRED → TRANSACTION_CREATED → GATEWAY_PROCESSED → COMPLETED
 *                                        │                   ├──────────► REFUNDED
 *                                        └──────► FAILED ◄───┘
 * </pre>
 *
 * <p>The step is stored on the payment transaction after every write, which makes the row itself
 * the saga's checkpoint. Only TRANSACTION_CREATED and GATEWAY_PROCESSED are ever observed on a
 * row that is not terminal, and those are what the stale saga recovery looks for.</p>
 */
public enum PaymentSagaStep {

    INITIATED(Set.of("LOCK_ACQUIRED", "FAILED")),

    LOCK_ACQUIRED(Set.of("TRANSACTION_CREATED", "FAILED")),

    TRANSACTION_CREATED(Set.of("GATEWAY_PROCESSED", "FAILED")),

    // charged: ends confirmed, refunded, or failed if even the refund is rejected
    GATEWAY_PROCESSED(Set.of("COMPLETED", "REFUNDED", "FAILED")),

    COMPLETED(Set.of()),

    FAILED(Set.of()),

    REFUNDED(Set.of());

    private final Set<String> validTransitions;

    PaymentSagaStep(Set<String> validTransitions) {
        this.validTransitions = validTransitions;
    }

    public boolean canTransitionTo(PaymentSagaStep target) {
        return validTransitions.contains(target.name());
    }

    public boolean isTerminal() {
        return validTransitions.isEmpty();
    }
}
