package com.lingxiao.cachify.function;

import com.lingxiao.cachify.execution.OnceExecution;

import java.util.concurrent.CompletableFuture;

public final class AsyncOnceFunction<R> {

    private final OnceExecution execution;
    private final NonBlockingCall<R> delegate;

    AsyncOnceFunction(OnceExecution execution, NonBlockingCall<R> delegate) {
        this.execution = execution;
        this.delegate = delegate;
    }

    /**
     * Cancelling the returned future cancels the wrapped stage; the lock is released either way.
     */
    @SuppressWarnings("unchecked")
    public CompletableFuture<R> call(Object... args) {
        return (CompletableFuture<R>) Calls.unchecked(() -> execution.call(args, Calls.invocation(delegate)));
    }

    public String key(Object... args) {
        return execution.key(args);
    }
}
