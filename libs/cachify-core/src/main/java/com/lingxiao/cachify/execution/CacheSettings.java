package com.lingxiao.cachify.execution;

import com.lingxiao.cachify.codec.ValueCodec;
import com.lingxiao.cachify.key.KeyTemplate;

import java.lang.reflect.Type;
import java.time.Duration;

/**
 * @param ttl null means no expiry
 * @param codec null uses the handle's default codec
 */
public record CacheSettings(String name,
                            KeyTemplate template,
                            String[] parameterNames,
                            Duration ttl,
                            Type valueType,
                            ValueCodec codec,
                            boolean degradeOnStoreError) {
    public CacheSettings {
        if (ttl != null && ttl.isNegative()) {
            throw new IllegalArgumentException("Cache ttl must not be negative, template=" + template);
        }
        if (ttl != null && ttl.isZero()) {
            ttl = null;
        }
    }
}
