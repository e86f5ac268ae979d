package com.givebridge.payment.service;

import com.givebridge.payment.client.DonationServiceClient;
import com.givebridge.payment.client.DonationServiceClient.ProcessDonationRequest;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Confirms a charged donation with the donation service.
 *
 * <p>One attempt per saga. Any error, an open circuit included, means "not confirmed", and the
 * saga then refunds the charge.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DonationConfirmationService {

    private final DonationServiceClient donationServiceClient;

    @CircuitBreaker(name = "donationService", fallbackMethod = "confirmFallback")
    public boolean confirm(Long donationId, String transactionRef, String status) {
        log.info("Confirming donation: donationId={}, transactionRef={}, status={}",
                donationId, transactionRef, status);
        donationServiceClient.processDonation(donationId, new ProcessDonationRequest(transactionRef, status));
        log.info("Donation confirmed: donationId={}, transactionRef={}", donationId, transactionRef);
        return true;
    }

    @SuppressWarnings("unused")
    private boolean confirmFallback(Long donationId, String transactionRef, String status, Throwable t) {
        log.warn("Donation confirmation failed: donationId={}, transactionRef={}, error={}",
                donationId, transactionRef, t.getMessage());
        return false;
    }
}
