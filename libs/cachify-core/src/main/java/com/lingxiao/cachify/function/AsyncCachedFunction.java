package com.lingxiao.cachify.function;

import com.lingxiao.cachify.execution.CacheExecution;

import java.util.concurrent.CompletableFuture;

public final class AsyncCachedFunction<R> {

    private final CacheExecution execution;
    private final NonBlockingCall<R> delegate;

    AsyncCachedFunction(CacheExecution execution, NonBlockingCall<R> delegate) {
        this.execution = execution;
        this.delegate = delegate;
    }

    @SuppressWarnings("unchecked")
    public CompletableFuture<R> call(Object... args) {
        return (CompletableFuture<R>) Calls.unchecked(() -> execution.call(args, Calls.invocation(delegate)));
    }

    @SuppressWarnings("unchecked")
    public CompletableFuture<Void> reset(Object... args) {
        return (CompletableFuture<Void>) execution.reset(args);
    }

    public String key(Object... args) {
        return execution.key(args);
    }
}
