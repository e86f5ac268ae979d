package com.givebridge.payment.scheduler;

import com.givebridge.payment.config.PaymentSagaProperties;
import com.givebridge.payment.entity.PaymentSagaStep;
import com.givebridge.payment.entity.PaymentTransaction;
import com.givebridge.payment.repository.PaymentTransactionRepository;
import com.givebridge.payment.saga.PaymentSagaOrchestrator;
import com.givebridge.payment.saga.PaymentSagaResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * Finds sagas that stopped before a terminal step, typically because their instance crashed,
 * and lets the orchestrator resume or fail them.
 *
 * <p>A saga counts as stale once its row has not changed for {@code payment.saga.recovery.stale-after}.
 * That window is longer than the lock TTL plus extension, so a live saga still holds its lock and
 * is skipped.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StalePaymentSagaRecovery {

    private static final EnumSet<PaymentSagaStep> RESUMABLE_STEPS =
            EnumSet.of(PaymentSagaStep.TRANSACTION_CREATED, PaymentSagaStep.GATEWAY_PROCESSED);

    private final PaymentTransactionRepository transactionRepository;
    private final PaymentSagaOrchestrator orchestrator;
    private final PaymentSagaProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${payment.saga.recovery.interval:PT5M}",
            initialDelayString = "${payment.saga.recovery.interval:PT5M}")
    @SchedulerLock(name = "StalePaymentSagaRecovery_recover", lockAtMostFor = "10m", lockAtLeastFor = "10s")
    public void recoverStaleSagas() {
        if (!properties.getRecovery().isEnabled()) {
            return;
        }
        LocalDateTime cutoff = LocalDateTime.now(clock).minus(properties.getRecovery().getStaleAfter());
        List<PaymentTransaction> stale = transactionRepository.findBySagaStepInAndUpdatedAtBeforeOrderByUpdatedAtAsc(
                RESUMABLE_STEPS, cutoff, PageRequest.of(0, properties.getRecovery().getBatchSize()));
        if (stale.isEmpty()) {
            return;
        }

        log.warn("Found {} stale payment saga(s) older than {}", stale.size(), cutoff);
        for (PaymentTransaction transaction : stale) {
            try {
                Optional<PaymentSagaResult> result = orchestrator.recover(transaction);
                result.ifPresent(r -> log.info("Stale saga resolved: transactionRef={}, status={}, reason={}",
                        r.transactionRef(), r.status(), r.failureReason()));
            } catch (Exception e) {
                log.error("Stale saga recovery failed: transactionRef={}", transaction.getTransactionRef(), e);
            }
        }
    }
}
