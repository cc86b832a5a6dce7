package com.lingxiao.cachify.execution;

import com.lingxiao.cachify.Cachify;
import com.lingxiao.cachify.StoreUnavailableException;
import com.lingxiao.cachify.codec.ValueCodecException;
import com.lingxiao.cachify.store.CacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

public class BlockingCacheExecution extends AbstractCacheExecution {

    private static final Logger log = LoggerFactory.getLogger(BlockingCacheExecution.class);

    public BlockingCacheExecution(Cachify cachify, CacheSettings settings) {
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

        Optional<String> stored = lookup(store, key);
        if (stored.isPresent()) {
            try {
                Object value = codec().decode(stored.get(), settings.valueType());
                metrics().cacheHit(settings.name());
                log.debug("Cache hit key={}", key);
                return value;
            } catch (ValueCodecException e) {
                log.warn("Discarding undecodable cache entry key={}", key, e);
                evict(store, key);
            }
        }

        metrics().cacheMiss(settings.name());
        Object result = invocation.proceed(args);
        save(store, key, result);
        return result;
    }

    @Override
    public Object reset(Object[] args) {
        String key = key(args);
        cachify.blockingStore().delete(key);
        log.debug("Cache reset key={}", key);
        return null;
    }

    private Optional<String> lookup(CacheStore store, String key) {
        try {
            return store.get(key);
        } catch (StoreUnavailableException e) {
            metrics().storeError(settings.name(), "get");
            if (!settings.degradeOnStoreError()) {
                throw e;
            }
            log.warn("Cache lookup failed, calling through key={}", key, e);
            return Optional.empty();
        }
    }

    private void save(CacheStore store, String key, Object result) {
        String encoded = codec().encode(result);
        try {
            store.set(key, encoded, settings.ttl());
        } catch (StoreUnavailableException e) {
            metrics().storeError(settings.name(), "set");
            if (!settings.degradeOnStoreError()) {
                throw e;
            }
            log.warn("Cache write failed, result returned uncached key={}", key, e);
        }
    }

    private void evict(CacheStore store, String key) {
        try {
            store.delete(key);
        } catch (StoreUnavailableException e) {
            log.warn("Evicting undecodable cache entry failed key={}", key, e);
        }
    }
}
