package com.lingxiao.cachify.function;

import com.lingxiao.cachify.Cachify;
import com.lingxiao.cachify.codec.ValueCodec;
import com.lingxiao.cachify.execution.CacheExecution;
import com.lingxiao.cachify.execution.CacheSettings;
import com.lingxiao.cachify.execution.CallMode;
import com.lingxiao.cachify.key.KeyTemplate;

import java.lang.reflect.Type;
import java.time.Duration;
import java.util.List;

public final class CachedBuilder {

    private final Cachify cachify;
    private final KeyTemplate template;
    private Duration ttl;
    private String[] parameterNames = new String[0];
    private ValueCodec codec;
    private Boolean degradeOnStoreError;
    private String name;

    public CachedBuilder(Cachify cachify, String keyTemplate) {
        this.cachify = cachify;
        this.template = KeyTemplate.parse(keyTemplate);
    }

    /**
     * Null or zero stores entries without expiry.
     */
    public CachedBuilder ttl(Duration ttl) {
        this.ttl = ttl;
        return this;
    }

    public CachedBuilder parameters(String... names) {
        this.parameterNames = names.clone();
        return this;
    }

    public CachedBuilder codec(ValueCodec codec) {
        this.codec = codec;
        return this;
    }

    public CachedBuilder degradeOnStoreError(boolean degradeOnStoreError) {
        this.degradeOnStoreError = degradeOnStoreError;
        return this;
    }

    public CachedBuilder name(String name) {
        this.name = name;
        return this;
    }

    /**
     * @param valueType type stored values are decoded back into, e.g. {@code User.class}
     */
    public <R> CachedFunction<R> blocking(Type valueType, BlockingCall<R> call) {
        return new CachedFunction<>(execution(CallMode.BLOCKING, valueType), call);
    }

    public <R> AsyncCachedFunction<R> nonBlocking(Type valueType, NonBlockingCall<R> call) {
        return new AsyncCachedFunction<>(execution(CallMode.NON_BLOCKING, valueType), call);
    }

    private CacheExecution execution(CallMode mode, Type valueType) {
        if (valueType == null) {
            throw new IllegalArgumentException("valueType is required, template=" + template);
        }
        template.validateAgainst(List.of(parameterNames));
        CacheSettings settings = new CacheSettings(
                name != null ? name : template.source(),
                template,
                parameterNames,
                ttl,
                valueType,
                codec,
                degradeOnStoreError != null ? degradeOnStoreError : cachify.degradeOnStoreError());
        return mode.cacheExecution(cachify, settings);
    }
}
