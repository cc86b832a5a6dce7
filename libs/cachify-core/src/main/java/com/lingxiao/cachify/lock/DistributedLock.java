package com.lingxiao.cachify.lock;

import com.lingxiao.cachify.Cachify;
import com.lingxiao.cachify.LockContentionException;
import com.lingxiao.cachify.store.AcquireOutcome;
import com.lingxiao.cachify.store.CacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * A named store-backed lock for code that is not shaped as a single function call.
 * The key is used as given (plus the handle's prefix); it is not a template.
 */
public final class DistributedLock {

    private static final Logger log = LoggerFactory.getLogger(DistributedLock.class);

    private final Cachify cachify;
    private final String key;
    private final Duration ttl;

    public DistributedLock(Cachify cachify, String key, Duration ttl) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Lock key is empty");
        }
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("Lock ttl must be positive, key=" + key);
        }
        this.cachify = cachify;
        this.key = cachify.storeKey(key);
        this.ttl = ttl;
    }

    public Optional<LockHandle> tryLock() {
        CacheStore store = cachify.blockingStore();
        AcquireOutcome outcome = store.tryAcquire(key, ttl);
        if (!outcome.isAcquired()) {
            log.debug("Lock contended key={}", key);
            return Optional.empty();
        }
        log.debug("Lock acquired key={}", key);
        return Optional.of(new LockHandle(store, key, outcome.token().orElseThrow()));
    }

    /**
     * Retries every {@code cachify.lock.poll-interval} until acquired.
     *
     * @throws LockContentionException when {@code wait} elapses first
     */
    public LockHandle lock(Duration wait) throws InterruptedException {
        long deadline = System.nanoTime() + wait.toNanos();
        long pollMillis = Math.max(1, cachify.lockPollInterval().toMillis());
        while (true) {
            Optional<LockHandle> handle = tryLock();
            if (handle.isPresent()) {
                return handle.get();
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new LockContentionException(key);
            }
            Thread.sleep(Math.min(pollMillis, Math.max(1, remaining / 1_000_000)));
        }
    }

    public boolean isLocked() {
        return cachify.blockingStore().get(key).isPresent();
    }

    public String key() {
        return key;
    }
}
