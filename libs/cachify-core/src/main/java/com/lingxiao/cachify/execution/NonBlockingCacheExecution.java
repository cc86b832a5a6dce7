package com.lingxiao.cachify.execution;

import com.lingxiao.cachify.Cachify;
import com.lingxiao.cachify.StoreUnavailableException;
import com.lingxiao.cachify.codec.ValueCodecException;
import com.lingxiao.cachify.store.AsyncCacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

public class NonBlockingCacheExecution extends AbstractCacheExecution {

    private static final Logger log = LoggerFactory.getLogger(NonBlockingCacheExecution.class);

    public NonBlockingCacheExecution(Cachify cachify, CacheSettings settings) {
        super(cachify, settings);
    }

    @Override
    public CallMode mode() {
        return CallMode.NON_BLOCKING;
    }

    @Override
    public CompletableFuture<Object> call(Object[] args, Invocation invocation) {
        String key;
        AsyncCacheStore store;
        try {
            key = key(args);
            store = cachify.nonBlockingStore();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }

        return lookup(store, key).thenComposeAsync(stored -> {
            if (stored.isPresent()) {
                try {
                    Object value = codec().decode(stored.get(), settings.valueType());
                    metrics().cacheHit(settings.name());
                    log.debug("Cache hit key={}", key);
                    return CompletableFuture.completedFuture(value);
                } catch (ValueCodecException e) {
                    log.warn("Discarding undecodable cache entry key={}", key, e);
                    evict(store, key);
                }
            }
            metrics().cacheMiss(settings.name());
            return Futures.invoke(invocation, args)
                    .thenCompose(result -> save(store, key, result)
                            .thenApplyAsync(ignored -> result, cachify.callExecutor()));
        }, cachify.callExecutor());
    }

    @Override
    public CompletableFuture<Void> reset(Object[] args) {
        try {
            String key = key(args);
            return cachify.nonBlockingStore().delete(key)
                    .thenRunAsync(() -> log.debug("Cache reset key={}", key), cachify.callExecutor());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private CompletableFuture<Optional<String>> lookup(AsyncCacheStore store, String key) {
        return store.get(key).handle((stored, ex) -> {
            if (ex == null) {
                return stored;
            }
            Throwable cause = Futures.unwrap(ex);
            if (cause instanceof StoreUnavailableException) {
                metrics().storeError(settings.name(), "get");
                if (settings.degradeOnStoreError()) {
                    log.warn("Cache lookup failed, calling through key={}", key, cause);
                    return Optional.empty();
                }
            }
            throw Futures.rethrow(cause);
        });
    }

    private CompletableFuture<Void> save(AsyncCacheStore store, String key, Object result) {
        String encoded;
        try {
            encoded = codec().encode(result);
        } catch (ValueCodecException e) {
            return CompletableFuture.failedFuture(e);
        }
        return store.set(key, encoded, settings.ttl()).handle((ignored, ex) -> {
            if (ex == null) {
                return null;
            }
            Throwable cause = Futures.unwrap(ex);
            if (cause instanceof StoreUnavailableException) {
                metrics().storeError(settings.name(), "set");
                if (settings.degradeOnStoreError()) {
                    log.warn("Cache write failed, result returned uncached key={}", key, cause);
                    return null;
                }
            }
            throw Futures.rethrow(cause);
        });
    }

    private void evict(AsyncCacheStore store, String key) {
        store.delete(key).whenComplete((ignored, ex) -> {
            if (ex != null) {
                log.warn("Evicting undecodable cache entry failed key={}", key, Futures.unwrap(ex));
            }
        });
    }
}
