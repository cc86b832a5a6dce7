package com.lingxiao.cachify.redis;

import com.lingxiao.cachify.store.AcquireOutcome;
import com.lingxiao.cachify.store.AsyncCacheStore;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Non-blocking store over Lettuce's reactive API. Each operation is one Redis round trip,
 * bridged to {@link CompletableFuture}.
 */
public class ReactiveRedisCacheStore implements AsyncCacheStore {

    private final ReactiveStringRedisTemplate redisTemplate;
    private final RedisErrorTranslator errorTranslator;
    private final DefaultRedisScript<Long> releaseScript;

    public ReactiveRedisCacheStore(ReactiveStringRedisTemplate redisTemplate) {
        this(redisTemplate, new RedisErrorTranslator());
    }

    public ReactiveRedisCacheStore(ReactiveStringRedisTemplate redisTemplate, RedisErrorTranslator errorTranslator) {
        this.redisTemplate = redisTemplate;
        this.errorTranslator = errorTranslator;
        this.releaseScript = RedisScripts.loadLongScript(RedisScripts.RELEASE);
    }

    @Override
    public CompletableFuture<Optional<String>> get(String key) {
        return translate("get", key, redisTemplate.opsForValue().get(key)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty()));
    }

    @Override
    public CompletableFuture<Void> set(String key, String value, Duration ttl) {
        Mono<Boolean> command = ttl == null || ttl.isZero()
                ? redisTemplate.opsForValue().set(key, value)
                : redisTemplate.opsForValue().set(key, value, ttl);
        return translate("set", key, command.then());
    }

    @Override
    public CompletableFuture<Void> delete(String key) {
        return translate("delete", key, redisTemplate.delete(key).then());
    }

    @Override
    public CompletableFuture<AcquireOutcome> tryAcquire(String key, Duration ttl) {
        String token = UUID.randomUUID().toString();
        return translate("acquire", key, redisTemplate.opsForValue().setIfAbsent(key, token, ttl)
                .map(acquired -> acquired ? AcquireOutcome.acquired(token) : AcquireOutcome.contended())
                .defaultIfEmpty(AcquireOutcome.contended()));
    }

    @Override
    public CompletableFuture<Boolean> release(String key, String token) {
        return translate("release", key, redisTemplate
                .execute(releaseScript, Collections.singletonList(key), List.of(token))
                .next()
                .map(res -> Long.valueOf(1L).equals(res))
                .defaultIfEmpty(false));
    }

    private <T> CompletableFuture<T> translate(String operation, String key, Mono<T> command) {
        return Mono.defer(() -> command)
                .onErrorMap(e -> errorTranslator.translate(operation, key, e))
                .toFuture();
    }
}
