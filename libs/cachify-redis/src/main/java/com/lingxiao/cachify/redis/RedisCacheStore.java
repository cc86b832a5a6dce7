package com.lingxiao.cachify.redis;

import com.lingxiao.cachify.store.AcquireOutcome;
import com.lingxiao.cachify.store.CacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Duration;
import java.util.Collections;
import java.util.Optional;
import java.util.UUID;

public class RedisCacheStore implements CacheStore {

    private static final Logger log = LoggerFactory.getLogger(RedisCacheStore.class);

    private final StringRedisTemplate redisTemplate;
    private final RedisErrorTranslator errorTranslator;
    private final DefaultRedisScript<Long> releaseScript;

    public RedisCacheStore(StringRedisTemplate redisTemplate) {
        this(redisTemplate, new RedisErrorTranslator());
    }

    public RedisCacheStore(StringRedisTemplate redisTemplate, RedisErrorTranslator errorTranslator) {
        this.redisTemplate = redisTemplate;
        this.errorTranslator = errorTranslator;
        this.releaseScript = RedisScripts.loadLongScript(RedisScripts.RELEASE);
    }

    @Override
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(key));
        } catch (RuntimeException e) {
            throw errorTranslator.translate("get", key, e);
        }
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        try {
            if (ttl == null || ttl.isZero()) {
                redisTemplate.opsForValue().set(key, value);
            } else {
                redisTemplate.opsForValue().set(key, value, ttl);
            }
        } catch (RuntimeException e) {
            throw errorTranslator.translate("set", key, e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            redisTemplate.delete(key);
        } catch (RuntimeException e) {
            throw errorTranslator.translate("delete", key, e);
        }
    }

    @Override
    public AcquireOutcome tryAcquire(String key, Duration ttl) {
        String token = UUID.randomUUID().toString();
        Boolean acquired;
        try {
            acquired = redisTemplate.opsForValue().setIfAbsent(key, token, ttl);
        } catch (RuntimeException e) {
            throw errorTranslator.translate("acquire", key, e);
        }
        if (Boolean.TRUE.equals(acquired)) {
            return AcquireOutcome.acquired(token);
        }
        log.debug("Lock contended key={}", key);
        return AcquireOutcome.contended();
    }

    @Override
    public boolean release(String key, String token) {
        try {
            Long res = redisTemplate.execute(releaseScript, Collections.singletonList(key), token);
            return Long.valueOf(1L).equals(res);
        } catch (RuntimeException e) {
            throw errorTranslator.translate("release", key, e);
        }
    }
}
