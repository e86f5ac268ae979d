package com.givebridge.payment.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.UUID;

/**
 * Caller-facing references: {@code TXN-PAY-20240301-1A2B3C4D} for payments and
 * {@code RF-1A2B3C4D} for refunds.
 */
@Component
@RequiredArgsConstructor
public class TransactionReferenceGenerator {

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final Clock clock;

    public String nextTransactionRef() {
        return "TXN-PAY-" + LocalDate.now(clock).format(DAY) + "-" + randomSuffix();
    }

    public String nextRefundRef() {
        return "RF-" + randomSuffix();
    }

    private static String randomSuffix() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT);
    }
}
