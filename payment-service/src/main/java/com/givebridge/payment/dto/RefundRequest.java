package com.givebridge.payment.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * @param amount null refunds the full payment
 */
public record RefundRequest(
        @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
        @Digits(integer = 17, fraction = 2) BigDecimal amount,
        @Size(max = 500) String reason
) {
}
