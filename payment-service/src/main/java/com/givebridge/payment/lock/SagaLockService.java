package com.givebridge.payment.lock;

import com.givebridge.common.lock.LockStore;
import com.givebridge.payment.entity.PaymentMethod;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Saga-scoped locks on the shared {@link LockStore}.
 *
 * <h3>Key</h3>
 * <p>{@code saga-lock:donation:{donationId}:method:{method}:amount:{amount}} with the amount at two
 * decimals. A retried identical request contends with the original; different amounts or methods
 * for the same donation do not.</p>
 *
 * <h3>Token</h3>
 * <p>{@code saga:{sagaId}:token:{uuid}}. Every store call that changes the key compares this token
 * first, so a saga whose lock expired can neither extend nor delete a lock that another saga
 * acquired since.</p>
 *
 * <h3>Failure policy</h3>
 * <ul>
 *   <li>acquire fails closed: a store error reads as "not acquired"</li>
 *   <li>validate fails closed: a store error reads as "not valid"</li>
 *   <li>release is idempotent: a lock that is already gone counts as released</li>
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SagaLockService {

    private static final String KEY_FORMAT = "saga-lock:donation:%d:method:%s:amount:%s";

    private final LockStore lockStore;
    private final Clock clock;

    public static String lockKey(Long donationId, PaymentMethod method, BigDecimal amount) {
        return String.format(KEY_FORMAT, donationId, method.name(),
                amount.setScale(2, RoundingMode.HALF_UP).toPlainString());
    }

    /**
     * Tries to take the lock, polling every {@code retryInterval} until {@code maxWait} has passed.
     *
     * @return the held lock, or empty if another saga holds it (or the store is unreachable)
     */
    public Optional<SagaLockState> acquire(String sagaId, Long donationId, PaymentMethod method,
                                           BigDecimal amount, Duration ttl, Duration maxWait,
                                           Duration retryInterval) {
        String key = lockKey(donationId, method, amount);
        String token = "saga:" + sagaId + ":token:" + UUID.randomUUID();
        long deadline = System.nanoTime() + maxWait.toNanos();

        try {
            while (true) {
                if (lockStore.tryAcquire(key, token, ttl)) {
                    Instant now = clock.instant();
                    log.info("Saga lock acquired: sagaId={}, key={}, ttl={}", sagaId, key, ttl);
                    return Optional.of(new SagaLockState(key, token, sagaId, now, now.plus(ttl)));
                }
                if (System.nanoTime() + retryInterval.toNanos() > deadline) {
                    log.warn("Saga lock contended, giving up: sagaId={}, key={}, waited={}", sagaId, key, maxWait);
                    return Optional.empty();
                }
                Thread.sleep(retryInterval.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for saga lock: sagaId={}, key={}", sagaId, key);
            return Optional.empty();
        } catch (RuntimeException e) {
            log.error("Lock store unavailable, refusing to proceed without a lock: sagaId={}, key={}",
                    sagaId, key, e);
            return Optional.empty();
        }
    }

    /**
     * Resets the TTL to {@code extension} if the lock is still ours.
     *
     * @return false if the lock was lost (state is then marked not acquired) or the store failed
     */
    public boolean extend(SagaLockState state, Duration extension) {
        if (!state.isAcquired()) {
            return false;
        }
        try {
            if (lockStore.extend(state.getLockKey(), state.getToken(), extension)) {
                state.extendedUntil(clock.instant().plus(extension));
                log.debug("Saga lock extended: sagaId={}, key={}, until={}",
                        state.getSagaId(), state.getLockKey(), state.getExpiresAt());
                return true;
            }
            state.markLost();
            log.warn("Saga lock lost before extension: sagaId={}, key={}", state.getSagaId(), state.getLockKey());
            return false;
        } catch (RuntimeException e) {
            log.warn("Saga lock extension failed: sagaId={}, key={}, error={}",
                    state.getSagaId(), state.getLockKey(), e.getMessage());
            return false;
        }
    }

    /**
     * Deletes the lock if it is still ours.
     *
     * @return true when the lock is gone afterwards, false only if the store could not be reached
     */
    public boolean release(SagaLockState state) {
        if (!state.isAcquired()) {
            return true;
        }
        try {
            boolean deleted = lockStore.release(state.getLockKey(), state.getToken());
            state.markReleased();
            log.info("Saga lock released: sagaId={}, key={}, deleted={}",
                    state.getSagaId(), state.getLockKey(), deleted);
            return true;
        } catch (RuntimeException e) {
            log.error("Saga lock release failed, lock stays until TTL expiry: sagaId={}, key={}, expiresAt={}",
                    state.getSagaId(), state.getLockKey(), state.getExpiresAt(), e);
            return false;
        }
    }

    /**
     * Read-only ownership check, used before irreversible steps.
     */
    public boolean isValid(SagaLockState state) {
        if (!state.isAcquired()) {
            return false;
        }
        try {
            if (lockStore.isHeldBy(state.getLockKey(), state.getToken())) {
                return true;
            }
            state.markLost();
            log.warn("Saga lock no longer held: sagaId={}, key={}", state.getSagaId(), state.getLockKey());
            return false;
        } catch (RuntimeException e) {
            log.error("Saga lock validation failed: sagaId={}, key={}", state.getSagaId(), state.getLockKey(), e);
            return false;
        }
    }
}
