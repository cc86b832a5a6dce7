package com.lingxiao.cachify.execution;

/**
 * Lock logic for one decoration, in the calling convention picked by {@link CallMode}.
 */
public interface OnceExecution {

    CallMode mode();

    Object call(Object[] args, Invocation invocation) throws Throwable;

    String key(Object[] args);
}
