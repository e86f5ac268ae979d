package com.givebridge.payment.entity;

public enum PaymentMethod {
    CREDIT_CARD,
    DEBIT_CARD,
    PAYPAL,
    BANK_TRANSFER,
    APPLE_PAY,
    GOOGLE_PAY,
    OTHER
}
