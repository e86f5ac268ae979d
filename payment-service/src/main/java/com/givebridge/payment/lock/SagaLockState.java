package com.givebridge.payment.lock;

import lombok.Getter;

import java.time.Instant;

/**
 * Lock held by exactly one saga run. Never shared between saga instances and never persisted.
 *
 * <p>{@code acquired} turns false once the lock is released, or as soon as the store shows that
 * the token no longer owns the key.</p>
 */
@Getter
public class SagaLockState {

    private final String lockKey;
    private final String token;
    private final String sagaId;
    private final Instant acquiredAt;
    private Instant expiresAt;
    private boolean acquired;

    SagaLockState(String lockKey, String token, String sagaId, Instant acquiredAt, Instant expiresAt) {
        this.lockKey = lockKey;
        this.token = token;
        this.sagaId = sagaId;
        this.acquiredAt = acquiredAt;
        this.expiresAt = expiresAt;
        this.acquired = true;
    }

    void extendedUntil(Instant expiresAt) {
        this.expiresAt = expiresAt;
    }

    void markLost() {
        this.acquired = false;
    }

    void markReleased() {
        this.acquired = false;
    }

    @Override
    public String toString() {
        return "SagaLockState[key=" + lockKey + ", sagaId=" + sagaId + ", acquired=" + acquired
                + ", expiresAt=" + expiresAt + "]";
    }
}
