package com.lingxiao.cachify.execution;

/**
 * Cache logic for one decoration, in the calling convention picked by {@link CallMode}.
 * Non-blocking implementations return {@code CompletableFuture}s from both operations.
 */
public interface CacheExecution {

    CallMode mode();

    Object call(Object[] args, Invocation invocation) throws Throwable;

    Object reset(Object[] args);

    String key(Object[] args);
}
