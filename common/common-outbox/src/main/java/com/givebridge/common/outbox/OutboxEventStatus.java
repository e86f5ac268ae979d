package com.givebridge.common.outbox;

/**
 * Delivery lifecycle of an {@link OutboxEvent}.
 *
 * <pre>
 *   PENDING ──► PROCESSING ──► COMPLETED
 *                  │  ▲   └──► CANCELLED (retry budget exhausted)
 *                  ▼  │ (retry once nextRetryAt has passed)
 *                FAILED
 * </pre>
 *
 * <p>A row left in PROCESSING by a crashed worker becomes claimable again after the configured
 * processing timeout.</p>
 */
public enum OutboxEventStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED
}
