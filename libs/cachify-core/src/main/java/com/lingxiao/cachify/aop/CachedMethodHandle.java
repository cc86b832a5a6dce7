package com.lingxiao.cachify.aop;

import com.lingxiao.cachify.execution.CacheExecution;
import com.lingxiao.cachify.execution.CallMode;

import java.lang.reflect.Method;
import java.util.concurrent.CompletableFuture;

/**
 * Reset side of a {@code @Cached} method. Takes the same arguments as the method.
 */
public final class CachedMethodHandle {

    private final String name;
    private final Method method;
    private final CacheExecution execution;

    CachedMethodHandle(String name, Method method, CacheExecution execution) {
        this.name = name;
        this.method = method;
        this.execution = execution;
    }

    public String name() {
        return name;
    }

    public Method method() {
        return method;
    }

    public CallMode mode() {
        return execution.mode();
    }

    public String key(Object... args) {
        return execution.key(args);
    }

    public void reset(Object... args) {
        requireMode(CallMode.BLOCKING, "reset", "resetAsync");
        execution.reset(args);
    }

    @SuppressWarnings("unchecked")
    public CompletableFuture<Void> resetAsync(Object... args) {
        requireMode(CallMode.NON_BLOCKING, "resetAsync", "reset");
        return (CompletableFuture<Void>) execution.reset(args);
    }

    CacheExecution execution() {
        return execution;
    }

    private void requireMode(CallMode expected, String called, String instead) {
        if (execution.mode() != expected) {
            throw new IllegalStateException("@Cached '" + name + "' is " + execution.mode()
                    + ", use " + instead + "() instead of " + called + "()");
        }
    }
}
