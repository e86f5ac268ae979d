package com.givebridge.payment.dto;

import com.givebridge.common.outbox.OutboxEvent;
import com.givebridge.common.outbox.OutboxEventStatus;

import java.time.LocalDateTime;

public record OutboxEventResponse(
        String eventId,
        String eventType,
        String aggregateId,
        OutboxEventStatus status,
        int retryCount,
        String errorMessage,
        LocalDateTime createdAt,
        LocalDateTime nextRetryAt
) {
    public static OutboxEventResponse from(OutboxEvent event) {
        return new OutboxEventResponse(event.getEventId(), event.getEventType(), event.getAggregateId(),
                event.getStatus(), event.getRetryCount(), event.getErrorMessage(),
                event.getCreatedAt(), event.getNextRetryAt());
    }
}
