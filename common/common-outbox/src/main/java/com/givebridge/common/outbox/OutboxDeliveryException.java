package com.givebridge.common.outbox;

/**
 * A broker refused or could not be reached for an outbox event.
 */
public class OutboxDeliveryException extends RuntimeException {

    public OutboxDeliveryException(String message) {
        super(message);
    }
}
