package com.givebridge.payment.dto;

import com.givebridge.payment.entity.PaymentStatus;

public record PaymentAcceptedResponse(String transactionRef, PaymentStatus status) {
}
