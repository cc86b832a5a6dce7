package com.lingxiao.cachify;

/**
 * Raised by {@code once} when another holder owns the lock and the decoration chose to throw.
 * Part of normal operation, not an infrastructure failure.
 */
public class LockContentionException extends CachifyException {

    private final String key;

    public LockContentionException(String key) {
        super("Lock is held by another caller key=" + key);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
