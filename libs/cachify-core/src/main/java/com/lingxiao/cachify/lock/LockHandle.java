package com.lingxiao.cachify.lock;

import com.lingxiao.cachify.StoreUnavailableException;
import com.lingxiao.cachify.store.CacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A held lock. Closing releases it once; later closes do nothing.
 * <pre>{@code
 * try (LockHandle ignored = cachify.lock("report-" + id).lock(Duration.ofSeconds(5))) {
 *     // exclusive across processes
 * }
 * }</pre>
 */
public final class LockHandle implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LockHandle.class);

    private final CacheStore store;
    private final String key;
    private final String token;
    private final AtomicBoolean released = new AtomicBoolean(false);

    LockHandle(CacheStore store, String key, String token) {
        this.store = store;
        this.key = key;
        this.token = token;
    }

    public String key() {
        return key;
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        try {
            if (!store.release(key, token)) {
                log.warn("Lock expired before release, exclusivity may have been lost key={}", key);
            }
        } catch (StoreUnavailableException e) {
            log.warn("Lock release failed, store reclaims it after ttl key={}", key, e);
        }
    }
}
