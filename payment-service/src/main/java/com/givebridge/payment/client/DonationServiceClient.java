package com.givebridge.payment.client;

import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

/**
 * Donation service endpoint that records the payment outcome on a donation.
 * Answers 204 when the donation was updated and 404 when it does not exist.
 */
@FeignClient(name = "donation-service", url = "${donation-service.url:http://localhost:8083}")
public interface DonationServiceClient {

    @PostMapping("/api/donations/{donationId}/process")
    void processDonation(@PathVariable("donationId") Long donationId,
                         @RequestBody ProcessDonationRequest request);

    record ProcessDonationRequest(String transactionId, String status) {}
}
