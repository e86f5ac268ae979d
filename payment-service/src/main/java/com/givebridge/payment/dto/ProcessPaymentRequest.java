package com.givebridge.payment.dto;

import com.givebridge.payment.entity.PaymentMethod;
import com.givebridge.payment.gateway.PaymentDetails;
import com.givebridge.payment.saga.PaymentRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

public record ProcessPaymentRequest(
        @NotNull @Positive Long donationId,
        @NotNull @Positive Long campaignId,
        @NotNull @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
        @Digits(integer = 17, fraction = 2) BigDecimal amount,
        @Size(min = 3, max = 3) String currency,
        @NotBlank @Size(max = 100) String donorName,
        @NotBlank @Email @Size(max = 200) String donorEmail,
        @NotNull PaymentMethod paymentMethod,
        @Valid PaymentDetailsRequest paymentDetails
) {
    private static final String DEFAULT_CURRENCY = "USD";

    public PaymentRequest toPaymentRequest() {
        return new PaymentRequest(donationId, campaignId, amount,
                currency == null ? DEFAULT_CURRENCY : currency.toUpperCase(),
                donorName, donorEmail, paymentMethod,
                paymentDetails == null ? PaymentDetails.empty() : paymentDetails.toPaymentDetails());
    }
}
