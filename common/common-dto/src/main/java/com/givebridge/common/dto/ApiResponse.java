package com.givebridge.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Response envelope shared by every GiveBridge REST endpoint.
 *
 * <pre>
 *   // success: {"success": true, "data": {...}}
 *   return ApiResponse.ok(payment);
 *
 *   // failure: {"success": false, "message": "Payment not found"}
 *   return ApiResponse.error("Payment not found");
 * </pre>
 *
 * @param <T> payload type
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
        boolean success,
        T data,
        String message
) {
    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, null);
    }

    /** Success with an informational message, e.g. an accepted-but-still-processing payment. */
    public static <T> ApiResponse<T> ok(T data, String message) {
        return new ApiResponse<>(true, data, message);
    }

    public static <T> ApiResponse<T> error(String message) {
        return new ApiResponse<>(false, null, message);
    }
}
