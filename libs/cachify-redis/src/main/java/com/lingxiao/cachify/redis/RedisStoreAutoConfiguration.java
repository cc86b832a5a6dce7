package com.lingxiao.cachify.redis;

import com.lingxiao.cachify.autoconfigure.CachifyAutoConfiguration;
import com.lingxiao.cachify.store.AsyncCacheStore;
import com.lingxiao.cachify.store.CacheStore;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.autoconfigure.data.redis.RedisReactiveAutoConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import reactor.core.publisher.Mono;

@AutoConfiguration(
        before = CachifyAutoConfiguration.class,
        after = {RedisAutoConfiguration.class, RedisReactiveAutoConfiguration.class})
@ConditionalOnClass(StringRedisTemplate.class)
public class RedisStoreAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public RedisErrorTranslator redisErrorTranslator() {
        return new RedisErrorTranslator();
    }

    @Bean
    @ConditionalOnBean(StringRedisTemplate.class)
    @ConditionalOnMissingBean(CacheStore.class)
    public RedisCacheStore redisCacheStore(StringRedisTemplate redisTemplate, RedisErrorTranslator errorTranslator) {
        return new RedisCacheStore(redisTemplate, errorTranslator);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(Mono.class)
    static class ReactiveStoreConfiguration {

        @Bean
        @ConditionalOnBean(ReactiveStringRedisTemplate.class)
        @ConditionalOnMissingBean(AsyncCacheStore.class)
        public ReactiveRedisCacheStore reactiveRedisCacheStore(ReactiveStringRedisTemplate redisTemplate,
                                                               RedisErrorTranslator errorTranslator) {
            return new ReactiveRedisCacheStore(redisTemplate, errorTranslator);
        }
    }
}
