package com.lingxiao.cachify.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lingxiao.cachify.Cachify;
import com.lingxiao.cachify.aop.CachedAspect;
import com.lingxiao.cachify.aop.CachedMethodRegistrar;
import com.lingxiao.cachify.aop.CachedMethodRegistry;
import com.lingxiao.cachify.aop.DurationParser;
import com.lingxiao.cachify.aop.OnceAspect;
import com.lingxiao.cachify.aop.SpelFallbackResolver;
import com.lingxiao.cachify.codec.JacksonValueCodec;
import com.lingxiao.cachify.codec.ValueCodec;
import com.lingxiao.cachify.execution.CachifyMetrics;
import com.lingxiao.cachify.store.AsyncCacheStore;
import com.lingxiao.cachify.store.CacheStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;

import java.util.concurrent.Executor;

@AutoConfiguration
@ConditionalOnProperty(prefix = "cachify", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(CachifyProperties.class)
public class CachifyAutoConfiguration {

    /**
     * Bean name of an optional {@link Executor} for non-blocking calls. It is looked up by name
     * so that no unqualified {@code Executor} bean is needed, which would replace Boot's
     * {@code applicationTaskExecutor}.
     */
    public static final String CALL_EXECUTOR_BEAN_NAME = "cachifyCallExecutor";

    @Bean
    @ConditionalOnMissingBean
    public ValueCodec cachifyValueCodec(ObjectProvider<ObjectMapper> objectMapper) {
        return new JacksonValueCodec(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public CachifyMetrics cachifyMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
        return new CachifyMetrics(meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public Cachify cachify(CachifyProperties properties,
                           ObjectProvider<CacheStore> store,
                           ObjectProvider<AsyncCacheStore> asyncStore,
                           ValueCodec codec,
                           CachifyMetrics metrics,
                           @Qualifier(CALL_EXECUTOR_BEAN_NAME) ObjectProvider<Executor> callExecutor) {
        return Cachify.builder()
                .store(store.getIfAvailable())
                .asyncStore(asyncStore.getIfAvailable())
                .codec(codec)
                .metrics(metrics)
                .keyPrefix(properties.getKeyPrefix())
                .defaultLockTtl(properties.getLock().getDefaultTtl())
                .lockPollInterval(properties.getLock().getPollInterval())
                .degradeOnStoreError(properties.getCache().isDegradeOnStoreError())
                .callExecutor(callExecutor.getIfAvailable())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public DurationParser cachifyDurationParser(Environment env) {
        return new DurationParser(env);
    }

    @Bean
    @ConditionalOnMissingBean
    public SpelFallbackResolver spelFallbackResolver() {
        return new SpelFallbackResolver();
    }

    @Bean
    @ConditionalOnMissingBean
    public CachedMethodRegistry cachedMethodRegistry(Cachify cachify, DurationParser durationParser) {
        return new CachedMethodRegistry(cachify, durationParser);
    }

    @Bean
    @ConditionalOnMissingBean
    public CachedMethodRegistrar cachedMethodRegistrar(ListableBeanFactory beanFactory,
                                                       CachedMethodRegistry registry) {
        return new CachedMethodRegistrar(beanFactory, registry);
    }

    @Bean
    @ConditionalOnMissingBean
    public CachedAspect cachedAspect(CachedMethodRegistry registry) {
        return new CachedAspect(registry);
    }

    @Bean
    @ConditionalOnMissingBean
    public OnceAspect onceAspect(Cachify cachify,
                                 DurationParser durationParser,
                                 SpelFallbackResolver fallbackResolver) {
        return new OnceAspect(cachify, durationParser, fallbackResolver);
    }
}
