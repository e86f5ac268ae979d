package com.givebridge.payment.entity;

public enum LedgerOperation {
    DEBIT,
    CREDIT
}
