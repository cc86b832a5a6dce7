package com.lingxiao.cachify.lock;

import com.lingxiao.cachify.Cachify;
import com.lingxiao.cachify.LockContentionException;
import com.lingxiao.cachify.support.InMemoryCacheStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DistributedLockTest {

    private InMemoryCacheStore store;
    private Cachify cachify;

    @BeforeEach
    void setUp() {
        store = new InMemoryCacheStore();
        cachify = Cachify.builder()
                .store(store)
                .keyPrefix("app:")
                .lockPollInterval(Duration.ofMillis(5))
                .build();
    }

    @Test
    @DisplayName("try-with-resources releases the lock")
    void scopedRelease() {
        DistributedLock lock = cachify.lock("report", Duration.ofSeconds(10));

        try (LockHandle handle = lock.tryLock().orElseThrow()) {
            assertThat(handle.key()).isEqualTo("app:report");
            assertThat(lock.isLocked()).isTrue();
            assertThat(lock.tryLock()).isEmpty();
        }

        assertThat(lock.isLocked()).isFalse();
    }

    @Test
    @DisplayName("closing twice releases once")
    void idempotentClose() {
        LockHandle handle = cachify.lock("report").tryLock().orElseThrow();

        handle.close();
        handle.close();

        assertThat(handle.isReleased()).isTrue();
        assertThat(store.releases()).isEqualTo(1);
    }

    @Test
    @DisplayName("lock(wait) gives up with LockContentionException")
    void waitTimesOut() {
        DistributedLock lock = cachify.lock("report");
        Optional<LockHandle> held = lock.tryLock();
        assertThat(held).isPresent();

        assertThatThrownBy(() -> lock.lock(Duration.ofMillis(30)))
                .isInstanceOf(LockContentionException.class)
                .hasMessageContaining("app:report");
    }

    @Test
    @DisplayName("lock(wait) acquires once the holder's ttl lapses")
    void waitAcquiresAfterExpiry() throws Exception {
        DistributedLock lock = cachify.lock("report", Duration.ofSeconds(1));
        lock.tryLock().orElseThrow();
        store.advance(Duration.ofSeconds(2));

        try (LockHandle handle = lock.lock(Duration.ofMillis(50))) {
            assertThat(handle.isReleased()).isFalse();
        }
    }

    @Test
    @DisplayName("empty keys and non-positive ttls are rejected")
    void validates() {
        assertThatThrownBy(() -> cachify.lock(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> cachify.lock("k", Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
    }
}
