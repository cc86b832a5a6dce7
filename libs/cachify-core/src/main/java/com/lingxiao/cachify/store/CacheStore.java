package com.lingxiao.cachify.store;

import java.time.Duration;
import java.util.Optional;

/**
 * Blocking client of the shared key-value store. Every operation is a remote round trip.
 * Backend failures surface as {@link com.lingxiao.cachify.StoreUnavailableException};
 * an absent key and a held lock are ordinary results.
 */
public interface CacheStore {

    Optional<String> get(String key);

    /**
     * @param ttl null or zero stores without expiry
     */
    void set(String key, String value, Duration ttl);

    void delete(String key);

    /**
     * Atomic set-if-absent with expiry. Under concurrent attempts exactly one caller
     * observes {@link AcquireResult#ACQUIRED}.
     */
    AcquireOutcome tryAcquire(String key, Duration ttl);

    /**
     * Deletes the lock only if it still carries {@code token}.
     *
     * @return false when the lock had already expired or passed to another holder
     */
    boolean release(String key, String token);
}
