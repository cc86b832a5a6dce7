package com.lingxiao.cachify.function;

import com.lingxiao.cachify.execution.CacheExecution;

public final class CachedFunction<R> {

    private final CacheExecution execution;
    private final BlockingCall<R> delegate;

    CachedFunction(CacheExecution execution, BlockingCall<R> delegate) {
        this.execution = execution;
        this.delegate = delegate;
    }

    /**
     * Returns the stored result for these arguments, or calls through and stores the result.
     * Failures of the wrapped function propagate unchanged and are never cached.
     */
    @SuppressWarnings("unchecked")
    public R call(Object... args) throws Exception {
        return Calls.rethrowing(() -> (R) execution.call(args, Calls.invocation(delegate)));
    }

    public void reset(Object... args) {
        execution.reset(args);
    }

    public String key(Object... args) {
        return execution.key(args);
    }
}
