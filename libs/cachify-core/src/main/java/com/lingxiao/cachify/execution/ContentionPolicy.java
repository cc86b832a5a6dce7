package com.lingxiao.cachify.execution;

import com.lingxiao.cachify.LockContentionException;

import java.util.function.Function;

/**
 * What a {@code once} call yields when the lock is held elsewhere: a fallback value or a
 * raised error. Calling through without the lock is not an option.
 */
@FunctionalInterface
public interface ContentionPolicy {

    /**
     * @return the value handed to the caller instead of the wrapped result
     */
    Object onContended(String key, Object[] args);

    static ContentionPolicy returning(Object fallback) {
        return (key, args) -> fallback;
    }

    static ContentionPolicy returningFrom(Function<Object[], ?> fallback) {
        return (key, args) -> fallback.apply(args);
    }

    static ContentionPolicy throwing() {
        return (key, args) -> {
            throw new LockContentionException(key);
        };
    }

    static ContentionPolicy throwing(Function<String, ? extends RuntimeException> error) {
        return (key, args) -> {
            throw error.apply(key);
        };
    }
}
