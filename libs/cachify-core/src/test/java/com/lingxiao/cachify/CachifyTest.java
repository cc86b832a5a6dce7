package com.lingxiao.cachify;

import com.lingxiao.cachify.function.CachedFunction;
import com.lingxiao.cachify.support.InMemoryCacheStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.ExecutorService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CachifyTest {

    @Test
    @DisplayName("calls without a store fail as not initialized, never as a miss")
    void missingStore() {
        Cachify cachify = Cachify.builder().build();
        CachedFunction<String> fn = cachify.cached("k-{id}").parameters("id").blocking(String.class, args -> "v");

        assertThatThrownBy(() -> fn.call(1)).isInstanceOf(CachifyNotInitializedException.class);
    }

    @Test
    @DisplayName("decorations made before close fail after it")
    void closed() throws Exception {
        Cachify cachify = Cachify.builder().store(new InMemoryCacheStore()).build();
        CachedFunction<String> fn = cachify.cached("k-{id}").parameters("id").blocking(String.class, args -> "v");
        assertThat(fn.call(1)).isEqualTo("v");

        cachify.close();

        assertThat(cachify.isClosed()).isTrue();
        assertThatThrownBy(() -> fn.call(1)).isInstanceOf(CachifyNotInitializedException.class);
        assertThatThrownBy(() -> fn.reset(1)).isInstanceOf(CachifyNotInitializedException.class);
    }

    @Test
    @DisplayName("the default call executor is owned by the handle and stopped on close")
    void ownsDefaultCallExecutor() {
        Cachify cachify = Cachify.builder().store(new InMemoryCacheStore()).build();
        ExecutorService executor = (ExecutorService) cachify.callExecutor();
        assertThat(executor.isShutdown()).isFalse();

        cachify.close();

        assertThat(executor.isShutdown()).isTrue();
    }

    @Test
    @DisplayName("unknown placeholders are rejected at decoration time")
    void validatesTemplateAtDecoration() {
        Cachify cachify = Cachify.builder().store(new InMemoryCacheStore()).build();

        assertThatThrownBy(() -> cachify.cached("k-{userId}").parameters("id").blocking(String.class, args -> "v"))
                .isInstanceOf(KeyResolutionException.class);
        assertThatThrownBy(() -> cachify.once("k-{userId}").parameters("id").blocking(args -> "v"))
                .isInstanceOf(KeyResolutionException.class);
    }

    @Test
    @DisplayName("lock durations must be positive")
    void rejectsInvalidDurations() {
        assertThatThrownBy(() -> Cachify.builder().defaultLockTtl(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Cachify.builder().lockPollInterval(Duration.ofMillis(-1)).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
