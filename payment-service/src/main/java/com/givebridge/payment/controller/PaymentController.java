package com.givebridge.payment.controller;

import com.givebridge.common.dto.ApiResponse;
import com.givebridge.payment.dto.PaymentAcceptedResponse;
import com.givebridge.payment.dto.PaymentResponse;
import com.givebridge.payment.dto.PaymentStatusResponse;
import com.givebridge.payment.dto.ProcessPaymentRequest;
import com.givebridge.payment.dto.RefundRequest;
import com.givebridge.payment.dto.RefundResponse;
import com.givebridge.payment.dto.ServiceInfoResponse;
import com.givebridge.payment.service.PaymentService;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Payment API.
 *
 * <p>Every endpoint is guarded by the {@code paymentApi} rate limiter; over the limit the call
 * fails with 429 through {@code GlobalExceptionHandler}.</p>
 */
@Slf4j
@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
public class PaymentController {

    private final PaymentService paymentService;

    /**
     * Starts a payment and returns 202 with the transaction reference while the saga runs.
     */
    @PostMapping
    @ResponseStatus(HttpStatus.ACCEPTED)
    @RateLimiter(name = "paymentApi")
    public ApiResponse<PaymentAcceptedResponse> processPayment(@Valid @RequestBody ProcessPaymentRequest request) {
        log.info("Payment requested: donationId={}, amount={}, method={}",
                request.donationId(), request.amount(), request.paymentMethod());
        PaymentAcceptedResponse accepted = paymentService.processPayment(request.toPaymentRequest());
        return ApiResponse.ok(accepted, "Payment is being processed");
    }

    @GetMapping("/{transactionRef}")
    @RateLimiter(name = "paymentApi")
    public ApiResponse<PaymentStatusResponse> getPayment(@PathVariable String transactionRef) {
        return ApiResponse.ok(paymentService.getPayment(transactionRef));
    }

    @GetMapping("/donation/{donationId}")
    @RateLimiter(name = "paymentApi")
    public ApiResponse<List<PaymentResponse>> getPaymentsByDonation(@PathVariable Long donationId) {
        return ApiResponse.ok(paymentService.getPaymentsByDonation(donationId));
    }

    @GetMapping("/info")
    public ApiResponse<ServiceInfoResponse> info() {
        return ApiResponse.ok(paymentService.serviceInfo());
    }

    @PostMapping("/{transactionRef}/refund")
    @RateLimiter(name = "paymentApi")
    public ApiResponse<RefundResponse> refund(@PathVariable String transactionRef,
                                              @Valid @RequestBody(required = false) RefundRequest request) {
        RefundResponse refund = paymentService.refund(transactionRef,
                request != null ? request.amount() : null,
                request != null ? request.reason() : null);
        return ApiResponse.ok(refund, "Refund processed");
    }
}
