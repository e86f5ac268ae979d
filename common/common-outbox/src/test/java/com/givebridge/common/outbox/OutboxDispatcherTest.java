package com.givebridge.common.outbox;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.cloud.stream.function.StreamBridge;
import org.springframework.messaging.Message;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class OutboxDispatcherTest {

    @Mock
    private StreamBridge streamBridge;

    @InjectMocks
    private OutboxDispatcher outboxDispatcher;

    private OutboxEvent event(String type) {
        return OutboxEvent.builder()
                .aggregateType("PaymentTransaction")
                .aggregateId("TXN-PAY-20240301-ABCDEF12")
                .eventType(type)
                .payload("{\"transactionRef\":\"TXN-PAY-20240301-ABCDEF12\"}")
                .createdAt(LocalDateTime.of(2024, 3, 1, 12, 0))
                .build();
    }

    @Test
    @DisplayName("messages are keyed by aggregate id and carry the event id header")
    @SuppressWarnings("unchecked")
    void dispatch_setsKeyAndHeaders() {
        OutboxEvent event = event("PaymentRefunded");
        given(streamBridge.send(anyString(), any(Message.class))).willReturn(true);

        outboxDispatcher.dispatch(event);

        ArgumentCaptor<Message<String>> message = ArgumentCaptor.forClass(Message.class);
        verify(streamBridge).send(eq("paymentRefundedEvents-out-0"), message.capture());
        assertThat(message.getValue().getPayload()).isEqualTo(event.getPayload());
        assertThat(message.getValue().getHeaders().get("kafka_messageKey")).isEqualTo("TXN-PAY-20240301-ABCDEF12");
        assertThat(message.getValue().getHeaders().get(OutboxDispatcher.EVENT_ID_HEADER)).isEqualTo(event.getEventId());
    }

    @Test
    @DisplayName("a refused send surfaces as a delivery failure")
    void dispatch_refused() {
        given(streamBridge.send(anyString(), any(Message.class))).willReturn(false);

        assertThatThrownBy(() -> outboxDispatcher.dispatch(event("PaymentCompleted")))
                .isInstanceOf(OutboxDeliveryException.class)
                .hasMessageContaining("paymentCompletedEvents-out-0");
    }

    @Test
    @DisplayName("unknown event types are never sent")
    void dispatch_unknownType() {
        assertThatThrownBy(() -> outboxDispatcher.dispatch(event("DonationCreated")))
                .isInstanceOf(OutboxDeliveryException.class);
        verifyNoInteractions(streamBridge);
    }
}
