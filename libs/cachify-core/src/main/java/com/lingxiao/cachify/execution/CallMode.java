package com.lingxiao.cachify.execution;

import com.lingxiao.cachify.Cachify;

import java.lang.reflect.Method;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Calling convention of a wrapped function, decided once per decoration. Each mode builds the
 * matching execution variant, so per-call code never inspects the function again.
 */
public enum CallMode {
    BLOCKING {
        @Override
        public CacheExecution cacheExecution(Cachify cachify, CacheSettings settings) {
            return new BlockingCacheExecution(cachify, settings);
        }

        @Override
        public OnceExecution onceExecution(Cachify cachify, OnceSettings settings) {
            return new BlockingOnceExecution(cachify, settings);
        }
    },
    NON_BLOCKING {
        @Override
        public CacheExecution cacheExecution(Cachify cachify, CacheSettings settings) {
            return new NonBlockingCacheExecution(cachify, settings);
        }

        @Override
        public OnceExecution onceExecution(Cachify cachify, OnceSettings settings) {
            return new NonBlockingOnceExecution(cachify, settings);
        }
    };

    public abstract CacheExecution cacheExecution(Cachify cachify, CacheSettings settings);

    public abstract OnceExecution onceExecution(Cachify cachify, OnceSettings settings);

    /**
     * {@code NON_BLOCKING} for methods declared to return {@code CompletionStage} or
     * {@code CompletableFuture}. Narrower stage types cannot carry the wrapper's future.
     */
    public static CallMode of(Method method) {
        Class<?> returnType = method.getReturnType();
        if (!CompletionStage.class.isAssignableFrom(returnType)) {
            return BLOCKING;
        }
        if (returnType.isAssignableFrom(CompletableFuture.class)) {
            return NON_BLOCKING;
        }
        throw new IllegalStateException("Unsupported asynchronous return type " + returnType.getName()
                + ", declare CompletionStage or CompletableFuture, method=" + method);
    }
}
