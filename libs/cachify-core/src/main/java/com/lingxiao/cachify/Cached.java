package com.lingxiao.cachify;

import java.lang.annotation.*;

/**
 * Caches the method result in the shared store under a key rendered from the call arguments,
 * e.g. {@code @Cached(key = "read_user-{userId}", ttl = "PT5M")}. Methods returning
 * {@code CompletionStage}/{@code CompletableFuture} are cached without blocking.
 * <p>
 * Invalidate through {@code CachedMethodRegistry#handle(name)}; nothing is invalidated
 * automatically on writes.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Cached {
    /**
     * Key template. Placeholders name method parameters or attribute paths on them:
     * {@code {user.id}}. Positional {@code {a0}}/{@code {p0}} are also bound.
     */
    String key();

    /**
     * Entry TTL, ISO-8601 ({@code PT5M}) or simple ({@code 300s}, bare numbers are seconds).
     * Property placeholders are resolved. Empty means no expiry.
     */
    String ttl() default "";

    /**
     * Registry name used to reset entries. Defaults to {@code SimpleClassName#method}.
     */
    String name() default "";
}
