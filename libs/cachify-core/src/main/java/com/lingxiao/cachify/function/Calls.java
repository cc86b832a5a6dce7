package com.lingxiao.cachify.function;

import com.lingxiao.cachify.execution.Invocation;

import java.lang.reflect.UndeclaredThrowableException;

final class Calls {

    private Calls() {
    }

    static <T> T rethrowing(ThrowingCall<T> call) throws Exception {
        try {
            return call.run();
        } catch (Exception | Error e) {
            throw e;
        } catch (Throwable t) {
            throw new UndeclaredThrowableException(t);
        }
    }

    static Invocation invocation(BlockingCall<?> call) {
        return call::call;
    }

    static Invocation invocation(NonBlockingCall<?> call) {
        return call::call;
    }

    static <T> T unchecked(ThrowingCall<T> call) {
        try {
            return call.run();
        } catch (RuntimeException | Error e) {
            throw e;
        } catch (Throwable t) {
            throw new UndeclaredThrowableException(t);
        }
    }

    @FunctionalInterface
    interface ThrowingCall<T> {
        T run() throws Throwable;
    }
}
