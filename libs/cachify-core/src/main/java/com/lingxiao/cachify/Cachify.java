package com.lingxiao.cachify;

import com.lingxiao.cachify.codec.JacksonValueCodec;
import com.lingxiao.cachify.codec.ValueCodec;
import com.lingxiao.cachify.execution.CachifyMetrics;
import com.lingxiao.cachify.function.CachedBuilder;
import com.lingxiao.cachify.function.OnceBuilder;
import com.lingxiao.cachify.lock.DistributedLock;
import com.lingxiao.cachify.store.AsyncCacheStore;
import com.lingxiao.cachify.store.CacheStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Process-lifetime handle to the shared store. Decorations hold a reference to it and look up
 * the store on every call: a handle without a store for the call's mode, or a closed handle,
 * fails that call with {@link CachifyNotInitializedException}.
 * <p>
 * Non-blocking calls run the wrapped function on the call executor, never on the thread that
 * completed a store future. Without one configured the handle owns a daemon pool named
 * {@code cachify-call-*} and shuts it down on {@link #close()}.
 * <pre>{@code
 * Cachify cachify = Cachify.builder().store(store).asyncStore(asyncStore).build();
 * CachedFunction<User> readUser = cachify.cached("read_user-{userId}")
 *         .ttl(Duration.ofMinutes(5))
 *         .parameters("userId")
 *         .blocking(User.class, args -> repository.find((Long) args[0]));
 * }</pre>
 */
public final class Cachify implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Cachify.class);

    private final CacheStore store;
    private final AsyncCacheStore asyncStore;
    private final ValueCodec codec;
    private final CachifyMetrics metrics;
    private final String keyPrefix;
    private final Duration defaultLockTtl;
    private final Duration lockPollInterval;
    private final boolean degradeOnStoreError;
    private final Executor callExecutor;
    private final ExecutorService ownedExecutor;
    private volatile boolean closed;

    private Cachify(Builder builder) {
        this.store = builder.store;
        this.asyncStore = builder.asyncStore;
        this.codec = builder.codec != null ? builder.codec : new JacksonValueCodec();
        this.metrics = builder.metrics != null ? builder.metrics : new CachifyMetrics(new SimpleMeterRegistry());
        this.keyPrefix = builder.keyPrefix == null ? "" : builder.keyPrefix;
        this.defaultLockTtl = builder.defaultLockTtl;
        this.lockPollInterval = builder.lockPollInterval;
        this.degradeOnStoreError = builder.degradeOnStoreError;
        if (builder.callExecutor != null) {
            this.callExecutor = builder.callExecutor;
            this.ownedExecutor = null;
        } else {
            CustomizableThreadFactory threads = new CustomizableThreadFactory("cachify-call-");
            threads.setDaemon(true);
            this.ownedExecutor = Executors.newCachedThreadPool(threads);
            this.callExecutor = ownedExecutor;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public CachedBuilder cached(String keyTemplate) {
        return new CachedBuilder(this, keyTemplate);
    }

    public OnceBuilder once(String keyTemplate) {
        return new OnceBuilder(this, keyTemplate);
    }

    public DistributedLock lock(String key) {
        return lock(key, defaultLockTtl);
    }

    public DistributedLock lock(String key, Duration ttl) {
        return new DistributedLock(this, key, ttl);
    }

    public CacheStore blockingStore() {
        ensureOpen();
        if (store == null) {
            throw new CachifyNotInitializedException("No blocking CacheStore configured; cannot serve blocking calls");
        }
        return store;
    }

    public AsyncCacheStore nonBlockingStore() {
        ensureOpen();
        if (asyncStore == null) {
            throw new CachifyNotInitializedException("No AsyncCacheStore configured; cannot serve non-blocking calls");
        }
        return asyncStore;
    }

    public String storeKey(String resolvedKey) {
        return keyPrefix + resolvedKey;
    }

    public ValueCodec codec() {
        return codec;
    }

    public CachifyMetrics metrics() {
        return metrics;
    }

    public Duration defaultLockTtl() {
        return defaultLockTtl;
    }

    public Duration lockPollInterval() {
        return lockPollInterval;
    }

    public boolean degradeOnStoreError() {
        return degradeOnStoreError;
    }

    public Executor callExecutor() {
        return callExecutor;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Detaches the handle from its stores. Later calls fail with
     * {@link CachifyNotInitializedException}; the stores and a supplied call executor are owned
     * by the caller.
     */
    @Override
    public void close() {
        if (!closed) {
            closed = true;
            if (ownedExecutor != null) {
                ownedExecutor.shutdown();
            }
            log.info("Cachify handle closed prefix={}", keyPrefix);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new CachifyNotInitializedException("Cachify handle has been closed");
        }
    }

    public static final class Builder {
        private CacheStore store;
        private AsyncCacheStore asyncStore;
        private ValueCodec codec;
        private CachifyMetrics metrics;
        private String keyPrefix = "cachify:";
        private Duration defaultLockTtl = Duration.ofSeconds(30);
        private Duration lockPollInterval = Duration.ofMillis(100);
        private boolean degradeOnStoreError = true;
        private Executor callExecutor;

        private Builder() {
        }

        public Builder store(CacheStore store) {
            this.store = store;
            return this;
        }

        public Builder asyncStore(AsyncCacheStore asyncStore) {
            this.asyncStore = asyncStore;
            return this;
        }

        public Builder codec(ValueCodec codec) {
            this.codec = codec;
            return this;
        }

        public Builder metrics(CachifyMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder keyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
            return this;
        }

        public Builder defaultLockTtl(Duration defaultLockTtl) {
            this.defaultLockTtl = defaultLockTtl;
            return this;
        }

        public Builder lockPollInterval(Duration lockPollInterval) {
            this.lockPollInterval = lockPollInterval;
            return this;
        }

        public Builder degradeOnStoreError(boolean degradeOnStoreError) {
            this.degradeOnStoreError = degradeOnStoreError;
            return this;
        }

        public Builder callExecutor(Executor callExecutor) {
            this.callExecutor = callExecutor;
            return this;
        }

        public Cachify build() {
            if (store == null && asyncStore == null) {
                log.warn("Cachify built without any store; decorated calls will fail until one is configured");
            }
            if (defaultLockTtl == null || defaultLockTtl.isZero() || defaultLockTtl.isNegative()) {
                throw new IllegalArgumentException("defaultLockTtl must be positive");
            }
            if (lockPollInterval == null || lockPollInterval.isZero() || lockPollInterval.isNegative()) {
                throw new IllegalArgumentException("lockPollInterval must be positive");
            }
            return new Cachify(this);
        }
    }
}
