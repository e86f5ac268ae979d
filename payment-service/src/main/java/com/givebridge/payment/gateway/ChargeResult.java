package com.givebridge.payment.gateway;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Outcome of a charge. {@code gatewayTransactionRef} may be present on a decline when the
 * processor assigned one before refusing.
 */
public record ChargeResult(
        boolean success,
        String gatewayName,
        String gatewayTransactionRef,
        BigDecimal fee,
        String failureReason,
        Map<String, String> metadata
) {
    public static ChargeResult succeeded(String gatewayName, String gatewayTransactionRef,
                                         BigDecimal fee, Map<String, String> metadata) {
        return new ChargeResult(true, gatewayName, gatewayTransactionRef, fee, null, metadata);
    }

    public static ChargeResult declined(String gatewayName, String gatewayTransactionRef, String failureReason) {
        return new ChargeResult(false, gatewayName, gatewayTransactionRef, null, failureReason, Map.of());
    }
}
