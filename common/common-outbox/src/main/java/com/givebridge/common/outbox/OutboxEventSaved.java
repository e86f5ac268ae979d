package com.givebridge.common.outbox;

/**
 * Application event raised inside the writing transaction whenever an outbox row is stored.
 */
public record OutboxEventSaved(String eventId, String eventType) {
}
