package com.lingxiao.cachify.execution;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

public class CachifyMetrics {

    private final MeterRegistry registry;

    public CachifyMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void cacheHit(String name) {
        counter("cachify.cache.requests", name, "result", "hit").increment();
    }

    public void cacheMiss(String name) {
        counter("cachify.cache.requests", name, "result", "miss").increment();
    }

    public void lockAcquired(String name) {
        counter("cachify.lock.attempts", name, "result", "acquired").increment();
    }

    public void lockContended(String name) {
        counter("cachify.lock.attempts", name, "result", "contended").increment();
    }

    public void storeError(String name, String operation) {
        counter("cachify.store.errors", name, "operation", operation).increment();
    }

    private Counter counter(String meter, String name, String tagKey, String tagValue) {
        return Counter.builder(meter)
                .tag("name", name)
                .tag(tagKey, tagValue)
                .register(registry);
    }
}
