package com.lingxiao.cachify;

/**
 * What a {@code once} call does when the store cannot be reached to acquire its lock.
 */
public enum StoreFailurePolicy {
    FAIL_CLOSED,
    FAIL_OPEN
}
