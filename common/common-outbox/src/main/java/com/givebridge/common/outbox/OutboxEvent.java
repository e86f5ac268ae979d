package com.givebridge.common.outbox;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One domain event waiting to be delivered to the message broker.
 *
 * <p>Rows are written in the same database transaction as the state change they describe and
 * are delivered later by {@link OutboxRelay}. Delivery is at-least-once: a crash between the
 * broker send and the completion update causes a redelivery, so consumers de-duplicate on
 * {@link #eventId}.</p>
 *
 * <p>Delivery state changes are applied as conditional updates in {@link OutboxEventRepository},
 * keyed on {@link #claimedAt}, so only the worker holding the current claim can finish a row.</p>
 *
 * <h3>Retry schedule</h3>
 * <p>After the n-th failed attempt the next attempt is due {@code min(2^n, 60)} minutes later.
 * Once {@code retryCount} reaches the configured maximum the row is CANCELLED and left for an
 * operator.</p>
 */
@Entity
@Table(name = "outbox_events", indexes = {
        @Index(name = "idx_outbox_status_created", columnList = "status, createdAt"),
        @Index(name = "idx_outbox_aggregate", columnList = "aggregateType, aggregateId")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OutboxEvent {

    static final long MAX_BACKOFF_MINUTES = 60;
    static final int MAX_ERROR_LENGTH = 2000;

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "outbox_event_seq")
    @SequenceGenerator(name = "outbox_event_seq", sequenceName = "outbox_event_seq", allocationSize = 50)
    private Long id;

    @Column(nullable = false, unique = true, length = 36)
    private String eventId;

    @Column(nullable = false)
    private String aggregateType;

    // back-reference to the originating aggregate, also used as the broker partition key
    private String aggregateId;

    @Column(nullable = false)
    private String eventType;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private OutboxEventStatus status;

    @Column(nullable = false)
    private int retryCount;

    private LocalDateTime nextRetryAt;

    @Column(length = 2000)
    private String errorMessage;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    private LocalDateTime claimedAt;

    private LocalDateTime processedAt;

    @Builder
    public OutboxEvent(String aggregateType, String aggregateId, String eventType,
                       String payload, LocalDateTime createdAt) {
        this.eventId = UUID.randomUUID().toString();
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
        this.eventType = eventType;
        this.payload = payload;
        this.status = OutboxEventStatus.PENDING;
        this.retryCount = 0;
        this.createdAt = createdAt != null ? createdAt : LocalDateTime.now();
    }

    /** Delay before the attempt that follows the {@code retryCount}-th failure. */
    public static Duration backoffFor(int retryCount) {
        if (retryCount >= 6) {
            return Duration.ofMinutes(MAX_BACKOFF_MINUTES);
        }
        return Duration.ofMinutes(Math.min(1L << retryCount, MAX_BACKOFF_MINUTES));
    }

    /** Status a row moves to after its {@code retryCount}-th failed attempt. */
    public static OutboxEventStatus statusAfterFailure(int retryCount, int maxRetries) {
        return retryCount >= maxRetries ? OutboxEventStatus.CANCELLED : OutboxEventStatus.FAILED;
    }

    static String truncateError(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, MAX_ERROR_LENGTH);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OutboxEvent that)) return false;
        return id != null && id.equals(that.getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
