package com.givebridge.payment.gateway;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.givebridge.payment.entity.PaymentMethod;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.Random;
import java.util.UUID;

/**
 * In-process stand-in for the card/wallet processors.
 *
 * <h3>Deterministic outcomes</h3>
 * <ul>
 *   <li>amount 13.00 is declined with "Insufficient funds"</li>
 *   <li>a card number ending in 0000 is declined with "Card declined"</li>
 * </ul>
 * Anything else is declined at {@code payment.gateway.failure-rate}.
 *
 * <h3>Fees</h3>
 * <table>
 *   <tr><td>Credit card, Apple Pay, Google Pay</td><td>2.9% + 0.30</td></tr>
 *   <tr><td>Debit card</td><td>2.4% + 0.30</td></tr>
 *   <tr><td>PayPal</td><td>3.4% + 0.30</td></tr>
 *   <tr><td>Bank transfer</td><td>0.8%</td></tr>
 *   <tr><td>Other</td><td>3.0% + 0.30</td></tr>
 * </table>
 *
 * <h3>Idempotency</h3>
 * <p>A charge repeated with the same idempotency key returns the first result. A second caller
 * arriving while the first charge is still in flight waits for it instead of charging again.
 * Results are remembered for {@code payment.gateway.idempotency-ttl}, up to
 * {@code payment.gateway.idempotency-max-entries} keys.</p>
 */
@Slf4j
@Component
public class SimulatedPaymentGatewayClient implements PaymentGatewayClient {

    private static final BigDecimal UNLUCKY_AMOUNT = new BigDecimal("13.00");
    private static final BigDecimal FIXED_FEE = new BigDecimal("0.30");
    private static final String[] RANDOM_DECLINES = {
            "Insufficient funds", "Card declined", "Expired card", "Invalid CVV", "Transaction limit exceeded"
    };

    private final GatewayProperties properties;
    private final Random random;
    private final Cache<String, ChargeResult> chargesByIdempotencyKey;

    @Autowired
    public SimulatedPaymentGatewayClient(GatewayProperties properties) {
        this(properties, new Random(), Ticker.systemTicker());
    }

    SimulatedPaymentGatewayClient(GatewayProperties properties, Random random, Ticker ticker) {
        this.properties = properties;
        this.random = random;
        this.chargesByIdempotencyKey = Caffeine.newBuilder()
                .maximumSize(properties.getIdempotencyMaxEntries())
                .expireAfterWrite(properties.getIdempotencyTtl())
                .ticker(ticker)
                .build();
    }

    @Override
    public ChargeResult charge(ChargeRequest request) {
        ChargeResult previous = chargesByIdempotencyKey.getIfPresent(request.idempotencyKey());
        if (previous != null) {
            log.info("Repeated charge answered from idempotency key: key={}", request.idempotencyKey());
            return previous;
        }
        // atomic per key: a concurrent caller with the same key blocks until the first charge is stored
        return chargesByIdempotencyKey.get(request.idempotencyKey(), key -> executeCharge(request));
    }

    private ChargeResult executeCharge(ChargeRequest request) {
        log.info("Charging: key={}, amount={} {}, method={}",
                request.idempotencyKey(), request.amount(), request.currency(), request.method());
        simulateLatency();

        String gatewayName = gatewayName(request.method());
        String gatewayRef = gatewayTransactionRef(request.method());
        String decline = declineReason(request);
        ChargeResult result;
        if (decline != null) {
            log.warn("Charge declined: key={}, reason={}", request.idempotencyKey(), decline);
            result = ChargeResult.declined(gatewayName, gatewayRef, decline);
        } else {
            BigDecimal fee = processingFee(request.amount(), request.method());
            result = ChargeResult.succeeded(gatewayName, gatewayRef, fee, Map.of(
                    "gateway", gatewayName,
                    "last4", details(request).last4(),
                    "auth_code", String.valueOf(100000 + random.nextInt(900000))));
            log.info("Charge captured: key={}, gatewayRef={}, fee={}", request.idempotencyKey(), gatewayRef, fee);
        }
        return result;
    }

    @Override
    public RefundResult refund(String gatewayTransactionRef, BigDecimal amount, String reason) {
        log.info("Refunding: gatewayRef={}, amount={}, reason={}", gatewayTransactionRef, amount, reason);
        simulateLatency();
        if (random.nextDouble() < properties.getRefundFailureRate()) {
            log.warn("Refund rejected: gatewayRef={}", gatewayTransactionRef);
            return RefundResult.failed("Refund failed: Original transaction not found or already refunded");
        }
        String refundRef = "rf_" + compactUuid();
        return RefundResult.succeeded(refundRef, amount);
    }

    @Override
    public String gatewayName(PaymentMethod method) {
        return switch (method) {
            case PAYPAL -> "PayPal";
            case BANK_TRANSFER -> "ACH Network";
            case APPLE_PAY -> "Apple Pay";
            case GOOGLE_PAY -> "Google Pay";
            default -> "Stripe";
        };
    }

    static BigDecimal processingFee(BigDecimal amount, PaymentMethod method) {
        BigDecimal fee = switch (method) {
            case CREDIT_CARD, APPLE_PAY, GOOGLE_PAY -> amount.multiply(new BigDecimal("0.029")).add(FIXED_FEE);
            case DEBIT_CARD -> amount.multiply(new BigDecimal("0.024")).add(FIXED_FEE);
            case PAYPAL -> amount.multiply(new BigDecimal("0.034")).add(FIXED_FEE);
            case BANK_TRANSFER -> amount.multiply(new BigDecimal("0.008"));
            case OTHER -> amount.multiply(new BigDecimal("0.030")).add(FIXED_FEE);
        };
        return fee.setScale(2, RoundingMode.HALF_UP);
    }

    private String declineReason(ChargeRequest request) {
        if (request.amount().compareTo(UNLUCKY_AMOUNT) == 0) {
            return "Insufficient funds";
        }
        String cardNumber = details(request).cardNumber();
        if (cardNumber != null && cardNumber.endsWith("0000")) {
            return "Card declined";
        }
        if (random.nextDouble() < properties.getFailureRate()) {
            return RANDOM_DECLINES[random.nextInt(RANDOM_DECLINES.length)];
        }
        return null;
    }

    private String gatewayTransactionRef(PaymentMethod method) {
        String prefix = switch (method) {
            case CREDIT_CARD, DEBIT_CARD -> "pi_";
            case PAYPAL -> "PAYID-";
            case BANK_TRANSFER -> "ACH-";
            case APPLE_PAY -> "ap_";
            case GOOGLE_PAY -> "gp_";
            case OTHER -> "tx_";
        };
        return prefix + compactUuid();
    }

    private static PaymentDetails details(ChargeRequest request) {
        return request.details() != null ? request.details() : PaymentDetails.empty();
    }

    private static String compactUuid() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 24);
    }

    private void simulateLatency() {
        long min = properties.getMinLatency().toMillis();
        long max = properties.getMaxLatency().toMillis();
        long delay = max > min ? min + (long) (random.nextDouble() * (max - min)) : min;
        if (delay <= 0) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the payment gateway", e);
        }
    }
}
