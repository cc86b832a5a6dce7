package com.lingxiao.cachify.store;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Non-blocking counterpart of {@link CacheStore}. Operations never block the calling thread;
 * backend failures complete the future exceptionally with
 * {@link com.lingxiao.cachify.StoreUnavailableException}.
 */
public interface AsyncCacheStore {

    CompletableFuture<Optional<String>> get(String key);

    CompletableFuture<Void> set(String key, String value, Duration ttl);

    CompletableFuture<Void> delete(String key);

    CompletableFuture<AcquireOutcome> tryAcquire(String key, Duration ttl);

    CompletableFuture<Boolean> release(String key, String token);
}
