package com.givebridge.common.exception;

import lombok.Getter;

/**
 * Unchecked exception raised when a payment-domain rule is violated.
 *
 * <p>Carries an {@link ErrorCode} so that {@link GlobalExceptionHandler} can turn it into an
 * RFC 7807 ProblemDetail with the right HTTP status.</p>
 *
 * <pre>
 *   throw new BusinessException(ErrorCode.PAYMENT_NOT_FOUND);
 *   throw new BusinessException(ErrorCode.INVALID_REFUND_AMOUNT, "Refund amount exceeds 25.00");
 * </pre>
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    /**
     * @param message detail that replaces the error code's default message
     */
    public BusinessException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
