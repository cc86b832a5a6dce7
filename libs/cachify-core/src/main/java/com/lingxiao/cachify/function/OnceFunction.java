package com.lingxiao.cachify.function;

import com.lingxiao.cachify.execution.OnceExecution;

public final class OnceFunction<R> {

    private final OnceExecution execution;
    private final BlockingCall<R> delegate;

    OnceFunction(OnceExecution execution, BlockingCall<R> delegate) {
        this.execution = execution;
        this.delegate = delegate;
    }

    /**
     * Returns the wrapped result, or the contention outcome when the lock is held elsewhere.
     * The lock is released on every exit path before this method returns.
     */
    @SuppressWarnings("unchecked")
    public R call(Object... args) throws Exception {
        return Calls.rethrowing(() -> (R) execution.call(args, Calls.invocation(delegate)));
    }

    public String key(Object... args) {
        return execution.key(args);
    }
}
