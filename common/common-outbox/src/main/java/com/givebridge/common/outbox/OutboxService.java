package com.givebridge.common.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Writes and tracks outbox rows.
 *
 * <h3>Writing</h3>
 * <p>{@link #saveEvent} must run inside the caller's transaction so that the event row commits or
 * rolls back together with the ledger/state change it describes. It refuses to run without one.</p>
 *
 * <h3>Delivery bookkeeping</h3>
 * <p>{@link #claim}, {@link #markCompleted} and {@link #markFailed} each run in their own short
 * transaction and are driven by {@link OutboxRelay}. The broker send happens between them, outside
 * any database transaction. A claim is identified by its {@code claimedAt} stamp; once another
 * worker reclaims a row, completing or failing it under the old stamp is a no-op.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutboxService {

    private final OutboxEventRepository outboxEventRepository;
    private final ObjectMapper objectMapper;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final OutboxProperties properties;
    private final Clock clock;

    /**
     * @param aggregateType originating aggregate, e.g. "PaymentTransaction"
     * @param aggregateId   originating aggregate key; also the broker message key
     * @param eventType     routing tag, e.g. "PaymentCompleted"
     * @param event         payload, serialized as JSON
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(String aggregateType, String aggregateId,
                                 String eventType, Object event) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize outbox event: type={}, aggregateId={}", eventType, aggregateId, e);
            throw new IllegalStateException("Failed to serialize outbox event " + eventType, e);
        }

        OutboxEvent outboxEvent = outboxEventRepository.save(OutboxEvent.builder()
                .aggregateType(aggregateType)
                .aggregateId(aggregateId)
                .eventType(eventType)
                .payload(payload)
                .createdAt(now())
                .build());
        applicationEventPublisher.publishEvent(new OutboxEventSaved(outboxEvent.getEventId(), eventType));
        log.debug("Outbox event saved: eventId={}, type={}, aggregateId={}",
                outboxEvent.getEventId(), eventType, aggregateId);
        return outboxEvent;
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> findDeliverable() {
        LocalDateTime now = now();
        return outboxEventRepository.findDeliverable(now, reclaimBefore(now),
                PageRequest.of(0, properties.getBatchSize()));
    }

    /**
     * Takes a delivery attempt for the row.
     *
     * @return the claim stamp to pass to {@link #markCompleted} or {@link #markFailed}, or empty if
     * another worker holds the row or it is no longer deliverable
     */
    @Transactional
    public Optional<LocalDateTime> claim(Long id) {
        LocalDateTime now = now();
        if (outboxEventRepository.claim(id, now, reclaimBefore(now)) != 1) {
            return Optional.empty();
        }
        return Optional.of(now);
    }

    /**
     * @return false if the claim was lost, in which case the row belongs to whoever reclaimed it
     */
    @Transactional
    public boolean markCompleted(Long id, LocalDateTime claimedAt) {
        if (outboxEventRepository.complete(id, claimedAt, now()) != 1) {
            log.warn("Outbox completion skipped, claim no longer held: id={}, claimedAt={}", id, claimedAt);
            return false;
        }
        log.debug("Outbox event delivered: id={}", id);
        return true;
    }

    /**
     * Records a failed attempt: FAILED with the next retry time, or CANCELLED once
     * {@code outbox.max-retries} attempts have failed.
     *
     * @return false if the claim was lost and nothing was recorded
     */
    @Transactional
    public boolean markFailed(Long id, LocalDateTime claimedAt, String error) {
        Optional<OutboxEvent> found = outboxEventRepository.findById(id);
        if (found.isEmpty()) {
            log.warn("Outbox failure not recorded, row is gone: id={}", id);
            return false;
        }
        OutboxEvent event = found.get();
        LocalDateTime now = now();
        int retryCount = event.getRetryCount() + 1;
        OutboxEventStatus status = OutboxEvent.statusAfterFailure(retryCount, properties.getMaxRetries());
        LocalDateTime nextRetryAt = status == OutboxEventStatus.FAILED
                ? now.plus(OutboxEvent.backoffFor(retryCount))
                : null;

        if (outboxEventRepository.fail(id, claimedAt, status, retryCount, nextRetryAt,
                OutboxEvent.truncateError(error)) != 1) {
            log.warn("Outbox failure skipped, claim no longer held: eventId={}, claimedAt={}",
                    event.getEventId(), claimedAt);
            return false;
        }

        if (status == OutboxEventStatus.CANCELLED) {
            log.error("Outbox event cancelled after {} attempts, manual intervention required: " +
                            "eventId={}, type={}, aggregateId={}, lastError={}",
                    retryCount, event.getEventId(), event.getEventType(), event.getAggregateId(), error);
        } else {
            log.warn("Outbox delivery failed: eventId={}, type={}, retryCount={}, nextRetryAt={}, error={}",
                    event.getEventId(), event.getEventType(), retryCount, nextRetryAt, error);
        }
        return true;
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> findCancelled(int limit) {
        return outboxEventRepository.findByStatusOrderByCreatedAtAsc(
                OutboxEventStatus.CANCELLED, PageRequest.of(0, limit));
    }

    // claim stamps are compared for equality after a database round trip, keep them at millisecond precision
    private LocalDateTime now() {
        return LocalDateTime.now(clock).truncatedTo(ChronoUnit.MILLIS);
    }

    private LocalDateTime reclaimBefore(LocalDateTime now) {
        return now.minus(properties.getProcessingTimeout());
    }
}
