package com.givebridge.payment.gateway;

import java.math.BigDecimal;

/**
 * Gateway answer to a refund request. A rejected refund carries only {@code failureReason};
 * the gateway error is reported here rather than thrown.
 */
public record RefundResult(
        boolean success,
        String refundRef,
        BigDecimal refundedAmount,
        String failureReason
) {
    public static RefundResult succeeded(String refundRef, BigDecimal refundedAmount) {
        return new RefundResult(true, refundRef, refundedAmount, null);
    }

    public static RefundResult failed(String failureReason) {
        return new RefundResult(false, null, null, failureReason);
    }
}
