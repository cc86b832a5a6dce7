package com.lingxiao.cachify.redis;

import com.lingxiao.cachify.Cachify;
import com.lingxiao.cachify.autoconfigure.CachifyAutoConfiguration;
import com.lingxiao.cachify.store.AsyncCacheStore;
import com.lingxiao.cachify.store.CacheStore;
import com.lingxiao.cachify.support.NoopCacheStore;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.autoconfigure.data.redis.RedisReactiveAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;

class RedisStoreAutoConfigurationTest {

    // Lettuce connects lazily, so the context starts without a server
    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    RedisAutoConfiguration.class,
                    RedisReactiveAutoConfiguration.class,
                    RedisStoreAutoConfiguration.class,
                    CachifyAutoConfiguration.class));

    @Test
    void wiresBothStoresIntoTheHandle() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(RedisCacheStore.class).hasSingleBean(ReactiveRedisCacheStore.class);
            Cachify cachify = context.getBean(Cachify.class);
            assertThat(cachify.blockingStore()).isSameAs(context.getBean(CacheStore.class));
            assertThat(cachify.nonBlockingStore()).isSameAs(context.getBean(AsyncCacheStore.class));
        });
    }

    @Test
    void backsOffForUserStore() {
        contextRunner.withBean(CacheStore.class, NoopCacheStore::new).run(context -> {
            assertThat(context).doesNotHaveBean(RedisCacheStore.class);
            assertThat(context.getBean(Cachify.class).blockingStore()).isInstanceOf(NoopCacheStore.class);
        });
    }
}
