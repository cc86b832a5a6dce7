package com.lingxiao.cachify.execution;

import com.lingxiao.cachify.Cachify;
import com.lingxiao.cachify.StoreFailurePolicy;
import com.lingxiao.cachify.StoreUnavailableException;
import com.lingxiao.cachify.store.AcquireOutcome;
import com.lingxiao.cachify.store.CacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class BlockingOnceExecution extends AbstractOnceExecution {

    private static final Logger log = LoggerFactory.getLogger(BlockingOnceExecution.class);

    public BlockingOnceExecution(Cachify cachify, OnceSettings settings) {
        super(cachify, settings);
    }

    @Override
    public CallMode mode() {
        return CallMode.BLOCKING;
    }

    @Override
    public Object call(Object[] args, Invocation invocation) throws Throwable {
        String key = key(args);
        CacheStore store = cachify.blockingStore();

        AcquireOutcome outcome;
        try {
            outcome = store.tryAcquire(key, settings.ttl());
        } catch (StoreUnavailableException e) {
            metrics().storeError(settings.name(), "acquire");
            if (settings.storeFailurePolicy() == StoreFailurePolicy.FAIL_OPEN) {
                log.warn("Lock store unavailable, calling through without lock key={}", key, e);
                return invocation.proceed(args);
            }
            throw e;
        }

        if (!outcome.isAcquired()) {
            metrics().lockContended(settings.name());
            log.debug("Lock contended key={}", key);
            return settings.contentionPolicy().onContended(key, args);
        }

        String token = outcome.token().orElseThrow();
        metrics().lockAcquired(settings.name());
        log.debug("Lock acquired key={}", key);
        try {
            return invocation.proceed(args);
        } finally {
            release(store, key, token);
        }
    }

    private void release(CacheStore store, String key, String token) {
        try {
            if (!store.release(key, token)) {
                log.warn("Lock expired before release, exclusivity may have been lost key={} ttl={}", key, settings.ttl());
            }
        } catch (StoreUnavailableException e) {
            metrics().storeError(settings.name(), "release");
            log.warn("Lock release failed, store reclaims it after ttl key={} ttl={}", key, settings.ttl(), e);
        }
    }
}
