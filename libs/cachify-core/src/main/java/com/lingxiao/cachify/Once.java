package com.lingxiao.cachify;

import java.lang.annotation.*;

/**
 * Runs the method only while holding a store-backed lock derived from the call arguments,
 * e.g. {@code @Once(key = "update-user-{userId}", onContended = ContendedAction.THROW)}.
 * A second call with the same key while the first is in flight is contention, from this or
 * any other process; there is no re-entrant path.
 * <p>
 * The lock TTL is a crash bound, not a heartbeat: if the method runs longer than the TTL the
 * store reclaims the key and a new caller may enter while the first is still running. Size
 * the TTL above the worst-case run time.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Once {
    String key();

    /**
     * Lock TTL; empty uses {@code cachify.lock.default-ttl}.
     */
    String ttl() default "";

    ContendedAction onContended() default ContendedAction.RETURN_FALLBACK;

    /**
     * SpEL evaluated against the arguments ({@code #userId}, {@code #a0}) when the lock is
     * contended and {@link #onContended()} is {@code RETURN_FALLBACK}. Empty returns null.
     */
    String fallback() default "";

    StoreFailurePolicy onStoreUnavailable() default StoreFailurePolicy.FAIL_CLOSED;
}
