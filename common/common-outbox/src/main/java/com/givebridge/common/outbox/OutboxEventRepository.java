package com.givebridge.common.outbox;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Outbox rows and the conditional updates that move them through delivery.
 *
 * <p>Every state change after the insert is a single {@code update ... where} statement whose
 * return value tells the caller whether it won. {@link #claim} hands out a delivery attempt and
 * stamps it with {@code claimedAt}; {@link #complete} and {@link #fail} only apply while that same
 * stamp is still on a PROCESSING row.</p>
 */
public interface OutboxEventRepository extends JpaRepository<OutboxEvent, Long> {

    /**
     * Rows a sweep may deliver now, oldest first: PENDING, FAILED whose retry time has come,
     * and PROCESSING rows whose claim is older than {@code reclaimBefore}.
     */
    @Query("""
            select e from OutboxEvent e
            where e.status = com.givebridge.common.outbox.OutboxEventStatus.PENDING
               or (e.status = com.givebridge.common.outbox.OutboxEventStatus.FAILED and e.nextRetryAt <= :now)
               or (e.status = com.givebridge.common.outbox.OutboxEventStatus.PROCESSING and e.claimedAt < :reclaimBefore)
            order by e.createdAt asc, e.id asc
            """)
    List<OutboxEvent> findDeliverable(@Param("now") LocalDateTime now,
                                      @Param("reclaimBefore") LocalDateTime reclaimBefore,
                                      Pageable pageable);

    /**
     * Conditional claim. Returns 1 only for the single worker whose update still saw the row in a
     * claimable state, so two sweeps never deliver the same row concurrently.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update OutboxEvent e
               set e.status = com.givebridge.common.outbox.OutboxEventStatus.PROCESSING, e.claimedAt = :now
             where e.id = :id
               and (e.status = com.givebridge.common.outbox.OutboxEventStatus.PENDING
                    or (e.status = com.givebridge.common.outbox.OutboxEventStatus.FAILED and e.nextRetryAt <= :now)
                    or (e.status = com.givebridge.common.outbox.OutboxEventStatus.PROCESSING and e.claimedAt < :reclaimBefore))
            """)
    int claim(@Param("id") Long id,
              @Param("now") LocalDateTime now,
              @Param("reclaimBefore") LocalDateTime reclaimBefore);

    /**
     * Marks the row delivered. Returns 0 when the claim made at {@code claimedAt} is no longer the
     * current one, i.e. the row was reclaimed by another worker or already finished.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update OutboxEvent e
               set e.status = com.givebridge.common.outbox.OutboxEventStatus.COMPLETED,
                   e.processedAt = :now, e.nextRetryAt = null, e.errorMessage = null
             where e.id = :id
               and e.status = com.givebridge.common.outbox.OutboxEventStatus.PROCESSING
               and e.claimedAt = :claimedAt
            """)
    int complete(@Param("id") Long id,
                 @Param("claimedAt") LocalDateTime claimedAt,
                 @Param("now") LocalDateTime now);

    /**
     * Records a failed attempt under the same ownership rule as {@link #complete}.
     * {@code status} is FAILED with a {@code nextRetryAt}, or CANCELLED once the retry budget is spent.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update OutboxEvent e
               set e.status = :status, e.retryCount = :retryCount, e.nextRetryAt = :nextRetryAt,
                   e.errorMessage = :error, e.claimedAt = null
             where e.id = :id
               and e.status = com.givebridge.common.outbox.OutboxEventStatus.PROCESSING
               and e.claimedAt = :claimedAt
            """)
    int fail(@Param("id") Long id,
             @Param("claimedAt") LocalDateTime claimedAt,
             @Param("status") OutboxEventStatus status,
             @Param("retryCount") int retryCount,
             @Param("nextRetryAt") LocalDateTime nextRetryAt,
             @Param("error") String error);

    List<OutboxEvent> findByStatusOrderByCreatedAtAsc(OutboxEventStatus status, Pageable pageable);
}
