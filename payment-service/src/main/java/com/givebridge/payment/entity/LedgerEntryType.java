package com.givebridge.payment.entity;

/**
 * CHARGEBACK and ADJUSTMENT are written by back-office tooling, never by the payment saga.
 */
public enum LedgerEntryType {
    PAYMENT,
    FEE,
    REFUND,
    CHARGEBACK,
    ADJUSTMENT
}
