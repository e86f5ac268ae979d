package com.givebridge.payment.dto;

import com.givebridge.payment.gateway.PaymentDetails;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;

public record PaymentDetailsRequest(
        @Size(max = 20) String cardNumber,
        @Size(max = 10) String expiryDate,
        @Size(max = 4) String cvv,
        @Size(max = 100) String cardHolderName,
        @Email @Size(max = 200) String payPalEmail,
        @Size(max = 50) String accountNumber,
        @Size(max = 50) String routingNumber,
        @Size(max = 200) String walletId,
        @Size(max = 200) String billingAddress,
        @Size(max = 100) String city,
        @Size(max = 20) String postalCode,
        @Size(max = 100) String country
) {
    public PaymentDetails toPaymentDetails() {
        return new PaymentDetails(cardNumber, expiryDate, cvv, cardHolderName, payPalEmail,
                accountNumber, routingNumber, walletId, billingAddress, city, postalCode, country);
    }

    @Override
    public String toString() {
        return toPaymentDetails().toString();
    }
}
