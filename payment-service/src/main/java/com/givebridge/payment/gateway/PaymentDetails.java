package com.givebridge.payment.gateway;

/**
 * Instrument data forwarded to the gateway. Never persisted; only the last four card digits
 * reach the ledger metadata.
 */
public record PaymentDetails(
        String cardNumber,
        String expiryDate,
        String cvv,
        String cardHolderName,
        String payPalEmail,
        String accountNumber,
        String routingNumber,
        String walletId,
        String billingAddress,
        String city,
        String postalCode,
        String country
) {
    public static PaymentDetails empty() {
        return new PaymentDetails(null, null, null, null, null, null, null, null, null, null, null, null);
    }

    public String last4() {
        if (cardNumber == null || cardNumber.length() < 4) {
            return "****";
        }
        return cardNumber.substring(cardNumber.length() - 4);
    }

    @Override
    public String toString() {
        return "PaymentDetails[card=****" + (cardNumber == null ? "" : last4()) + "]";
    }
}
