package com.lingxiao.cachify.redis;

import com.lingxiao.cachify.Cachify;
import com.lingxiao.cachify.execution.ContentionPolicy;
import com.lingxiao.cachify.function.AsyncCachedFunction;
import com.lingxiao.cachify.function.AsyncOnceFunction;
import com.lingxiao.cachify.function.CachedFunction;
import com.lingxiao.cachify.function.OnceFunction;
import com.lingxiao.cachify.lock.LockHandle;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the decorators against a real Redis. Skipped when Docker is not available.
 */
@Testcontainers(disabledWithoutDocker = true)
class RedisStoreIntegrationTest {

    @Container
    static final GenericContainer<?> REDIS =
            new GenericContainer<>(DockerImageName.parse("redis:7-alpine")).withExposedPorts(6379);

    private static LettuceConnectionFactory connectionFactory;
    private static StringRedisTemplate redisTemplate;
    private static Cachify cachify;

    @BeforeAll
    static void connect() {
        connectionFactory = new LettuceConnectionFactory(
                new RedisStandaloneConfiguration(REDIS.getHost(), REDIS.getMappedPort(6379)));
        connectionFactory.afterPropertiesSet();
        redisTemplate = new StringRedisTemplate(connectionFactory);
        cachify = Cachify.builder()
                .store(new RedisCacheStore(redisTemplate))
                .asyncStore(new ReactiveRedisCacheStore(new ReactiveStringRedisTemplate(connectionFactory)))
                .keyPrefix("it:")
                .build();
    }

    @AfterAll
    static void disconnect() {
        cachify.close();
        connectionFactory.destroy();
    }

    @BeforeEach
    void flush() {
        redisTemplate.execute((RedisCallback<Object>) connection -> {
            connection.serverCommands().flushAll();
            return null;
        });
    }

    @Test
    void cachesWithTtlAndResets() throws Exception {
        AtomicInteger loads = new AtomicInteger();
        CachedFunction<String> fn = cachify.cached("u-{id}")
                .ttl(Duration.ofSeconds(300))
                .parameters("id")
                .blocking(String.class, args -> "user-" + args[0] + "-" + loads.incrementAndGet());

        assertThat(fn.call(1)).isEqualTo("user-1-1");
        assertThat(fn.call(1)).isEqualTo("user-1-1");
        assertThat(redisTemplate.getExpire("it:u-1")).isBetween(1L, 300L);

        fn.reset(1);
        assertThat(fn.call(1)).isEqualTo("user-1-2");
    }

    @Test
    void cachesNonBlocking() {
        AtomicInteger loads = new AtomicInteger();
        AsyncCachedFunction<List<Integer>> fn = cachify.cached("scores-{id}")
                .parameters("id")
                .nonBlocking(List.class, args -> {
                    loads.incrementAndGet();
                    return CompletableFuture.completedFuture(List.of(1, 2, 3));
                });

        assertThat(fn.call(4).join()).containsExactly(1, 2, 3);
        assertThat(fn.call(4).join()).containsExactly(1, 2, 3);
        assertThat(loads).hasValue(1);

        fn.reset(4).join();
        assertThat(redisTemplate.hasKey("it:scores-4")).isFalse();
    }

    @Test
    void onceExcludesConcurrentHolder() throws Exception {
        OnceFunction<String> fn = cachify.once("job-{id}")
                .ttl(Duration.ofSeconds(30))
                .parameters("id")
                .onContended(ContentionPolicy.returning("X"))
                .blocking(args -> "done");

        try (LockHandle ignored = cachify.lock("job-1").tryLock().orElseThrow()) {
            assertThat(fn.call(1)).isEqualTo("X");
        }
        assertThat(fn.call(1)).isEqualTo("done");
        assertThat(redisTemplate.hasKey("it:job-1")).isFalse();
    }

    @Test
    void releaseDoesNotDeleteAnotherHoldersLock() {
        RedisCacheStore store = new RedisCacheStore(redisTemplate);
        String token = store.tryAcquire("it:shared", Duration.ofSeconds(30)).token().orElseThrow();

        assertThat(store.release("it:shared", "someone-else")).isFalse();
        assertThat(redisTemplate.hasKey("it:shared")).isTrue();
        assertThat(store.release("it:shared", token)).isTrue();
    }

    @Test
    void onceNonBlockingReleasesOnCompletion() {
        AsyncOnceFunction<String> fn = cachify.once("sync")
                .nonBlocking(args -> CompletableFuture.supplyAsync(() -> "synced"));

        assertThat(fn.call().join()).isEqualTo("synced");
        assertThat(redisTemplate.hasKey("it:sync")).isFalse();
    }
}
