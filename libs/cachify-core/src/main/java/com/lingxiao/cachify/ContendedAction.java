package com.lingxiao.cachify;

public enum ContendedAction {
    RETURN_FALLBACK,
    THROW
}
