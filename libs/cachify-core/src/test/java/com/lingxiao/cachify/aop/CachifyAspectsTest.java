package com.lingxiao.cachify.aop;

import com.lingxiao.cachify.Cached;
import com.lingxiao.cachify.ContendedAction;
import com.lingxiao.cachify.LockContentionException;
import com.lingxiao.cachify.Once;
import com.lingxiao.cachify.autoconfigure.CachifyAutoConfiguration;
import com.lingxiao.cachify.execution.CallMode;
import com.lingxiao.cachify.store.AsyncCacheStore;
import com.lingxiao.cachify.support.InMemoryCacheStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.aop.AopAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("@Cached / @Once aspects")
class CachifyAspectsTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(AopAutoConfiguration.class, CachifyAutoConfiguration.class))
            .withUserConfiguration(StoreConfig.class, UserService.class)
            .withPropertyValues("cachify.key-prefix=test:", "users.ttl=300s");

    public record User(long id, String name) {
    }

    @Configuration(proxyBeanMethods = false)
    static class StoreConfig {

        @Bean
        InMemoryCacheStore inMemoryCacheStore() {
            return new InMemoryCacheStore();
        }

        @Bean
        AsyncCacheStore asyncCacheStore(InMemoryCacheStore store) {
            return store.async();
        }
    }

    public static class UserService {

        final AtomicInteger loads = new AtomicInteger();

        @Cached(key = "user-{id}", ttl = "${users.ttl}")
        public User find(long id) {
            loads.incrementAndGet();
            return new User(id, "user-" + id);
        }

        @Cached(key = "tags-{id}", name = "tags")
        public CompletableFuture<List<String>> tags(long id) {
            loads.incrementAndGet();
            return CompletableFuture.supplyAsync(() -> List.of("t" + id));
        }

        @Once(key = "sync-{tenant}", fallback = "'busy-' + #tenant")
        public String sync(String tenant) {
            return "synced-" + tenant;
        }

        @Once(key = "count-{tenant}", onContended = ContendedAction.THROW)
        public int count(String tenant) {
            return 1;
        }

        @Once(key = "job-{order.id}", ttl = "PT10S")
        public CompletableFuture<String> job(User order) {
            return CompletableFuture.completedFuture("ran-" + order.id());
        }
    }

    public static class BadService {

        @Once(key = "bad")
        public int bad() {
            return 1;
        }
    }

    @Test
    @DisplayName("@Cached serves repeated calls from the store and resets by name")
    void cachedBlocking() {
        contextRunner.run(context -> {
            UserService service = context.getBean(UserService.class);
            InMemoryCacheStore store = context.getBean(InMemoryCacheStore.class);

            assertThat(service.find(1L)).isEqualTo(new User(1L, "user-1"));
            assertThat(service.find(1L)).isEqualTo(new User(1L, "user-1"));
            assertThat(service.loads).hasValue(1);
            assertThat(store.ttl("test:user-1")).hasValue(Duration.ofSeconds(300));

            CachedMethodHandle handle = context.getBean(CachedMethodRegistry.class).handle("UserService#find");
            assertThat(handle.mode()).isEqualTo(CallMode.BLOCKING);
            handle.reset(1L);
            service.find(1L);
            assertThat(service.loads).hasValue(2);
        });
    }

    @Test
    @DisplayName("@Cached on a future-returning method caches the completed value")
    void cachedNonBlocking() {
        contextRunner.run(context -> {
            UserService service = context.getBean(UserService.class);
            CachedMethodRegistry registry = context.getBean(CachedMethodRegistry.class);

            assertThat(service.tags(3L).join()).containsExactly("t3");
            assertThat(service.tags(3L).join()).containsExactly("t3");
            assertThat(service.loads).hasValue(1);

            CachedMethodHandle handle = registry.handle("tags");
            assertThatThrownBy(() -> handle.reset(3L)).isInstanceOf(IllegalStateException.class);
            handle.resetAsync(3L).join();
            service.tags(3L).join();
            assertThat(service.loads).hasValue(2);
        });
    }

    @Test
    @DisplayName("handles are registered at startup, before the first call")
    void eagerRegistration() {
        contextRunner.run(context -> {
            CachedMethodRegistry registry = context.getBean(CachedMethodRegistry.class);

            assertThat(registry.find("UserService#find")).isPresent();
            assertThat(registry.handle("UserService#find").key(5L)).isEqualTo("test:user-5");
            assertThatThrownBy(() -> registry.handle("nope")).isInstanceOf(IllegalArgumentException.class);
        });
    }

    @Test
    @DisplayName("@Once returns the evaluated fallback while the lock is held elsewhere")
    void onceFallback() {
        contextRunner.run(context -> {
            UserService service = context.getBean(UserService.class);
            InMemoryCacheStore store = context.getBean(InMemoryCacheStore.class);

            assertThat(service.sync("acme")).isEqualTo("synced-acme");
            store.tryAcquire("test:sync-acme", Duration.ofSeconds(30));
            assertThat(service.sync("acme")).isEqualTo("busy-acme");
            assertThat(service.sync("other")).isEqualTo("synced-other");
        });
    }

    @Test
    @DisplayName("@Once with onContended=THROW raises LockContentionException")
    void onceThrows() {
        contextRunner.run(context -> {
            UserService service = context.getBean(UserService.class);
            context.getBean(InMemoryCacheStore.class).tryAcquire("test:count-acme", Duration.ofSeconds(30));

            assertThatThrownBy(() -> service.count("acme")).isInstanceOf(LockContentionException.class);
        });
    }

    @Test
    @DisplayName("@Once resolves nested attributes and releases after a future-returning call")
    void onceNonBlocking() {
        contextRunner.run(context -> {
            UserService service = context.getBean(UserService.class);
            InMemoryCacheStore store = context.getBean(InMemoryCacheStore.class);

            assertThat(service.job(new User(9L, "n")).join()).isEqualTo("ran-9");
            assertThat(store.acquires()).isEqualTo(1);
            assertThat(store.peek("test:job-9")).isEmpty();
        });
    }

    @Test
    @DisplayName("@Once on a primitive method needs a fallback or THROW")
    void primitiveWithoutFallback() {
        contextRunner.withUserConfiguration(BadService.class).run(context -> {
            BadService service = context.getBean(BadService.class);

            assertThatThrownBy(service::bad)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("primitive");
        });
    }
}
