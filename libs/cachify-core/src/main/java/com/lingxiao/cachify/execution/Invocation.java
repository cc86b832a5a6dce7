package com.lingxiao.cachify.execution;

/**
 * The wrapped call. In non-blocking mode it returns a {@code CompletionStage} (or null).
 */
@FunctionalInterface
public interface Invocation {
    Object proceed(Object[] args) throws Throwable;
}
