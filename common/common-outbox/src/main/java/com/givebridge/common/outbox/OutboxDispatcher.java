package com.givebridge.common.outbox;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cloud.stream.function.StreamBridge;
import org.springframework.messaging.Message;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.stereotype.Component;

/**
 * Hands one outbox row to the broker through Spring Cloud Stream.
 *
 * <p>The message key is the aggregate id, so every event of one payment lands on the same
 * partition in order. {@code eventId} travels as a header for consumer-side de-duplication.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutboxDispatcher {

    public static final String EVENT_ID_HEADER = "eventId";
    public static final String EVENT_TYPE_HEADER = "eventType";

    private final StreamBridge streamBridge;

    /**
     * @throws OutboxDeliveryException if no binding exists for the event type or the send is refused
     */
    public void dispatch(OutboxEvent event) {
        String binding = resolveBindingName(event.getEventType());
        Message<String> message = MessageBuilder
                .withPayload(event.getPayload())
                .setHeader("kafka_messageKey", event.getAggregateId())
                .setHeader(EVENT_ID_HEADER, event.getEventId())
                .setHeader(EVENT_TYPE_HEADER, event.getEventType())
                .build();

        if (!streamBridge.send(binding, message)) {
            throw new OutboxDeliveryException("StreamBridge refused message for binding " + binding);
        }
        log.debug("Outbox event sent: binding={}, eventId={}, aggregateId={}",
                binding, event.getEventId(), event.getAggregateId());
    }

    String resolveBindingName(String eventType) {
        return switch (eventType) {
            case "PaymentCompleted" -> "paymentCompletedEvents-out-0";
            case "PaymentFailed" -> "paymentFailedEvents-out-0";
            case "PaymentRefunded" -> "paymentRefundedEvents-out-0";
            default -> throw new OutboxDeliveryException("No binding configured for event type " + eventType);
        };
    }
}
