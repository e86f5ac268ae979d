package com.givebridge.common.outbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Pageable;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class OutboxServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T12:00:00Z"), ZoneOffset.UTC);
    private static final LocalDateTime NOW = LocalDateTime.of(2024, 3, 1, 12, 0);

    @Mock
    private OutboxEventRepository outboxEventRepository;

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private OutboxProperties properties;
    private OutboxService outboxService;

    record SampleEvent(String transactionRef, BigDecimal amount, LocalDateTime at) {
    }

    @BeforeEach
    void setUp() {
        properties = new OutboxProperties();
        ObjectMapper objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        outboxService = new OutboxService(outboxEventRepository, objectMapper,
                applicationEventPublisher, properties, CLOCK);
    }

    @Test
    @DisplayName("saving an event stores camelCase JSON as a PENDING row and announces it")
    void saveEvent_storesPendingRow() {
        given(outboxEventRepository.save(any(OutboxEvent.class))).willAnswer(inv -> inv.getArgument(0));

        OutboxEvent saved = outboxService.saveEvent("PaymentTransaction", "TXN-1", "PaymentCompleted",
                new SampleEvent("TXN-1", new BigDecimal("100.00"), NOW));

        assertThat(saved.getStatus()).isEqualTo(OutboxEventStatus.PENDING);
        assertThat(saved.getPayload())
                .contains("\"transactionRef\":\"TXN-1\"")
                .contains("\"amount\":100.00")
                .contains("\"at\":\"2024-03-01T12:00:00\"");
        assertThat(saved.getCreatedAt()).isEqualTo(NOW);

        ArgumentCaptor<OutboxEventSaved> announced = ArgumentCaptor.forClass(OutboxEventSaved.class);
        verify(applicationEventPublisher).publishEvent(announced.capture());
        assertThat(announced.getValue().eventId()).isEqualTo(saved.getEventId());
        assertThat(announced.getValue().eventType()).isEqualTo("PaymentCompleted");
    }

    @Test
    @DisplayName("deliverable rows are queried with the reclaim cut-off and batch size")
    void findDeliverable_usesReclaimWindow() {
        given(outboxEventRepository.findDeliverable(eq(NOW), eq(NOW.minusMinutes(5)), any(Pageable.class)))
                .willReturn(List.of());

        outboxService.findDeliverable();

        ArgumentCaptor<Pageable> page = ArgumentCaptor.forClass(Pageable.class);
        verify(outboxEventRepository).findDeliverable(eq(NOW), eq(NOW.minusMinutes(5)), page.capture());
        assertThat(page.getValue().getPageSize()).isEqualTo(10);
    }

    @Test
    @DisplayName("claim hands back its stamp only when the conditional update touched the row")
    void claim_reflectsUpdateCount() {
        given(outboxEventRepository.claim(1L, NOW, NOW.minusMinutes(5))).willReturn(1);
        given(outboxEventRepository.claim(2L, NOW, NOW.minusMinutes(5))).willReturn(0);

        assertThat(outboxService.claim(1L)).contains(NOW);
        assertThat(outboxService.claim(2L)).isEmpty();
    }

    @Test
    @DisplayName("completion is applied under the caller's claim stamp")
    void markCompleted_usesClaimStamp() {
        LocalDateTime claimedAt = NOW.minusSeconds(3);
        given(outboxEventRepository.complete(1L, claimedAt, NOW)).willReturn(1);

        assertThat(outboxService.markCompleted(1L, claimedAt)).isTrue();
    }

    @Test
    @DisplayName("completing a row another worker reclaimed changes nothing and reports the lost claim")
    void markCompleted_lostClaim() {
        LocalDateTime staleClaim = NOW.minusMinutes(6);
        given(outboxEventRepository.complete(1L, staleClaim, NOW)).willReturn(0);

        assertThat(outboxService.markCompleted(1L, staleClaim)).isFalse();
    }

    @Test
    @DisplayName("a failed attempt is scheduled for retry with exponential backoff")
    void markFailed_schedulesRetry() {
        OutboxEvent event = pendingEvent();
        ReflectionTestUtils.setField(event, "retryCount", 2);
        given(outboxEventRepository.findById(7L)).willReturn(Optional.of(event));
        given(outboxEventRepository.fail(7L, NOW, OutboxEventStatus.FAILED, 3, NOW.plusMinutes(8), "timeout"))
                .willReturn(1);

        assertThat(outboxService.markFailed(7L, NOW, "timeout")).isTrue();
    }

    @Test
    @DisplayName("a failure uses the configured retry budget")
    void markFailed_usesMaxRetries() {
        properties.setMaxRetries(1);
        given(outboxEventRepository.findById(7L)).willReturn(Optional.of(pendingEvent()));
        given(outboxEventRepository.fail(7L, NOW, OutboxEventStatus.CANCELLED, 1, null, "timeout"))
                .willReturn(1);

        assertThat(outboxService.markFailed(7L, NOW, "timeout")).isTrue();
        verify(outboxEventRepository).fail(7L, NOW, OutboxEventStatus.CANCELLED, 1, null, "timeout");
    }

    @Test
    @DisplayName("a failure reported under a lost claim is not recorded")
    void markFailed_lostClaim() {
        given(outboxEventRepository.findById(7L)).willReturn(Optional.of(pendingEvent()));
        given(outboxEventRepository.fail(eq(7L), eq(NOW), any(), anyInt(), any(), any())).willReturn(0);

        assertThat(outboxService.markFailed(7L, NOW, "timeout")).isFalse();
    }

    @Test
    @DisplayName("a failure for a missing row is ignored")
    void markFailed_missingRow() {
        given(outboxEventRepository.findById(7L)).willReturn(Optional.empty());

        assertThat(outboxService.markFailed(7L, NOW, "timeout")).isFalse();
        verify(outboxEventRepository, never()).fail(anyLong(), any(), any(), anyInt(), any(), any());
    }

    private OutboxEvent pendingEvent() {
        return OutboxEvent.builder()
                .aggregateType("PaymentTransaction").aggregateId("TXN-1")
                .eventType("PaymentFailed").payload("{}").createdAt(NOW).build();
    }
}
