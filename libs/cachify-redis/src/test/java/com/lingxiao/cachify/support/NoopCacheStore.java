package com.lingxiao.cachify.support;

import com.lingxiao.cachify.store.AcquireOutcome;
import com.lingxiao.cachify.store.CacheStore;

import java.time.Duration;
import java.util.Optional;

public class NoopCacheStore implements CacheStore {

    @Override
    public Optional<String> get(String key) {
        return Optional.empty();
    }

    @Override
    public void set(String key, String value, Duration ttl) {
    }

    @Override
    public void delete(String key) {
    }

    @Override
    public AcquireOutcome tryAcquire(String key, Duration ttl) {
        return AcquireOutcome.acquired("noop");
    }

    @Override
    public boolean release(String key, String token) {
        return true;
    }
}
