package com.givebridge.common.lock;

import java.time.Duration;

/**
 * Keyed, TTL-based mutual exclusion over a store shared by every service instance.
 *
 * <p>Each holder is identified by an opaque token. Release and extend only act when the stored
 * token still equals the caller's token, so a holder whose entry expired and was re-acquired by
 * someone else can never remove or prolong the new owner's lock.</p>
 *
 * <p>Implementations throw on infrastructure failure; callers decide whether to fail closed.</p>
 */
public interface LockStore {

    /**
     * Stores {@code token} under {@code key} only if the key is absent.
     *
     * @return true if this call created the entry
     */
    boolean tryAcquire(String key, String token, Duration ttl);

    /**
     * Resets the TTL of {@code key} to {@code ttl} if it is still held by {@code token}.
     *
     * @return false when the key is gone or owned by another token
     */
    boolean extend(String key, String token, Duration ttl);

    /**
     * Deletes {@code key} if it is still held by {@code token}.
     *
     * @return true if an entry was deleted, false if nothing owned by {@code token} remained
     */
    boolean release(String key, String token);

    boolean isHeldBy(String key, String token);
}
