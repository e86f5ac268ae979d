package com.givebridge.common.outbox;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Delivers outbox rows to the broker.
 *
 * <h3>One sweep</h3>
 * <ol>
 *   <li>Fetch up to {@code outbox.batch-size} deliverable rows, oldest first</li>
 *   <li>Claim each row (conditional update to PROCESSING). A row another worker claimed first is skipped</li>
 *   <li>Send it. Success marks it COMPLETED, failure schedules a retry or cancels it. Both
 *   updates are skipped if another worker has reclaimed the row in the meantime</li>
 * </ol>
 *
 * <p>A row whose bookkeeping throws is logged and left for reclaim; the rest of the batch is still
 * delivered.</p>
 *
 * <p>No database transaction spans the broker send. If the process dies after sending but before
 * {@code markCompleted}, the row stays PROCESSING until the processing timeout passes and is then
 * sent again.</p>
 *
 * <p>The periodic sweep is additionally guarded by ShedLock so that, across instances, only one
 * runs at a time. Sweeps triggered by {@link OutboxSweepWorker} rely on the per-row claim alone.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutboxRelay {

    private final OutboxService outboxService;
    private final OutboxDispatcher outboxDispatcher;

    @Scheduled(fixedDelayString = "${outbox.sweep-interval:PT30S}",
            initialDelayString = "${outbox.sweep-interval:PT30S}")
    @SchedulerLock(name = "OutboxRelay_sweep", lockAtMostFor = "5m", lockAtLeastFor = "5s")
    public void scheduledSweep() {
        int delivered = sweep();
        if (delivered > 0) {
            log.info("Outbox sweep delivered {} event(s)", delivered);
        }
    }

    /**
     * Runs one sweep.
     *
     * @return number of rows delivered
     */
    public int sweep() {
        List<OutboxEvent> candidates = outboxService.findDeliverable();
        int delivered = 0;
        for (OutboxEvent candidate : candidates) {
            try {
                if (deliver(candidate)) {
                    delivered++;
                }
            } catch (RuntimeException e) {
                // the row stays PROCESSING and is reclaimed after the processing timeout
                log.error("Outbox delivery aborted: eventId={}, type={}",
                        candidate.getEventId(), candidate.getEventType(), e);
            }
        }
        return delivered;
    }

    private boolean deliver(OutboxEvent event) {
        Optional<LocalDateTime> claim = outboxService.claim(event.getId());
        if (claim.isEmpty()) {
            log.debug("Outbox event claimed elsewhere: eventId={}", event.getEventId());
            return false;
        }
        LocalDateTime claimedAt = claim.get();

        try {
            outboxDispatcher.dispatch(event);
        } catch (RuntimeException e) {
            outboxService.markFailed(event.getId(), claimedAt,
                    e.getMessage() != null ? e.getMessage() : e.getClass().getName());
            return false;
        }

        return outboxService.markCompleted(event.getId(), claimedAt);
    }
}
