package com.givebridge.common.exception;

import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.net.URI;
import java.util.stream.Collectors;

/**
 * Central exception translation for every GiveBridge REST endpoint.
 *
 * <p>All errors leave the service as RFC 7807 {@link ProblemDetail} bodies whose {@code type}
 * is derived from the {@link ErrorCode} name:</p>
 * <pre>
 *   {
 *     "type": "https://givebridge.org/errors/duplicate_payment_in_progress",
 *     "status": 409,
 *     "detail": "Duplicate payment detected - another payment is already in progress for this donation"
 *   }
 * </pre>
 *
 * <h3>Handled</h3>
 * <ol>
 *   <li><b>BusinessException</b>: domain rule violations</li>
 *   <li><b>MethodArgumentNotValidException</b>: Bean Validation failures on request bodies</li>
 *   <li><b>RequestNotPermitted / BulkheadFullException / CallNotPermittedException</b>:
 *       Resilience4j traffic control</li>
 * </ol>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String ERROR_TYPE_BASE = "https://givebridge.org/errors/";

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ProblemDetail> handleBusinessException(BusinessException e) {
        ErrorCode errorCode = e.getErrorCode();
        if (errorCode.getStatus().is5xxServerError()) {
            log.warn("Business failure: code={}, detail={}", errorCode, e.getMessage());
        }
        return problem(errorCode, e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemDetail> handleValidation(MethodArgumentNotValidException e) {
        String detail = e.getBindingResult().getFieldErrors().stream()
                .map(GlobalExceptionHandler::describe)
                .collect(Collectors.joining(", "));
        return problem(ErrorCode.INVALID_INPUT, detail.isEmpty() ? ErrorCode.INVALID_INPUT.getMessage() : detail);
    }

    @ExceptionHandler(RequestNotPermitted.class)
    public ResponseEntity<ProblemDetail> handleRateLimitExceeded(RequestNotPermitted e) {
        log.warn("Rate limit exceeded: {}", e.getMessage());
        return problem(ErrorCode.RATE_LIMIT_EXCEEDED, ErrorCode.RATE_LIMIT_EXCEEDED.getMessage());
    }

    @ExceptionHandler(BulkheadFullException.class)
    public ResponseEntity<ProblemDetail> handleBulkheadFull(BulkheadFullException e) {
        log.warn("Bulkhead full: {}", e.getMessage());
        return problem(ErrorCode.BULKHEAD_FULL, ErrorCode.BULKHEAD_FULL.getMessage());
    }

    @ExceptionHandler(CallNotPermittedException.class)
    public ResponseEntity<ProblemDetail> handleCircuitBreakerOpen(CallNotPermittedException e) {
        log.warn("Circuit breaker open: {}", e.getMessage());
        return problem(ErrorCode.CIRCUIT_BREAKER_OPEN, ErrorCode.CIRCUIT_BREAKER_OPEN.getMessage());
    }

    private static ResponseEntity<ProblemDetail> problem(ErrorCode errorCode, String detail) {
        HttpStatus status = errorCode.getStatus();
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setType(URI.create(ERROR_TYPE_BASE + errorCode.name().toLowerCase()));
        return ResponseEntity.status(status).body(problem);
    }

    private static String describe(FieldError error) {
        return error.getField() + ": " + error.getDefaultMessage();
    }
}
