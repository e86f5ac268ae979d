package com.givebridge.common.outbox;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs an extra sweep as soon as a transaction that wrote outbox rows commits, so events do not
 * wait for the next periodic sweep.
 *
 * <p>Owns a single worker thread that is started and stopped with the application context.
 * Requests that arrive while a sweep is already queued are coalesced into that sweep. Anything a
 * triggered sweep misses is picked up by the periodic one in {@link OutboxRelay}.</p>
 */
@Slf4j
@Component
public class OutboxSweepWorker implements SmartLifecycle {

    private final OutboxRelay outboxRelay;
    private final OutboxProperties properties;
    private final AtomicBoolean sweepQueued = new AtomicBoolean(false);

    private volatile ThreadPoolTaskExecutor executor;

    public OutboxSweepWorker(OutboxRelay outboxRelay, OutboxProperties properties) {
        this.outboxRelay = outboxRelay;
        this.properties = properties;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onEventSaved(OutboxEventSaved saved) {
        if (properties.isSweepOnPublish()) {
            requestSweep();
        }
    }

    /**
     * @return true if a new sweep was queued, false if one was already waiting or the worker is stopped
     */
    public boolean requestSweep() {
        ThreadPoolTaskExecutor current = executor;
        if (current == null || !sweepQueued.compareAndSet(false, true)) {
            return false;
        }
        try {
            current.execute(this::runSweep);
            return true;
        } catch (RejectedExecutionException e) {
            sweepQueued.set(false);
            log.debug("Outbox sweep request rejected, worker is shutting down");
            return false;
        }
    }

    private void runSweep() {
        sweepQueued.set(false);
        try {
            outboxRelay.sweep();
        } catch (RuntimeException e) {
            log.error("Triggered outbox sweep failed, periodic sweep will retry", e);
        }
    }

    @Override
    public void start() {
        // one running sweep plus at most one queued, see requestSweep
        ThreadPoolTaskExecutor pool = new ThreadPoolTaskExecutor();
        pool.setCorePoolSize(1);
        pool.setMaxPoolSize(1);
        pool.setQueueCapacity(1);
        pool.setThreadNamePrefix("outbox-sweep-");
        pool.setDaemon(true);
        pool.setWaitForTasksToCompleteOnShutdown(true);
        pool.setAwaitTerminationSeconds(10);
        pool.initialize();
        executor = pool;
        log.info("Outbox sweep worker started");
    }

    @Override
    public void stop() {
        ThreadPoolTaskExecutor current = executor;
        executor = null;
        if (current == null) {
            return;
        }
        current.shutdown();
        log.info("Outbox sweep worker stopped");
    }

    @Override
    public boolean isRunning() {
        return executor != null;
    }
}
