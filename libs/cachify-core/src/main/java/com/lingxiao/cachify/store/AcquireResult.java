package com.lingxiao.cachify.store;

public enum AcquireResult {
    ACQUIRED,
    CONTENDED
}
