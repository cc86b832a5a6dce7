package com.lingxiao.cachify;

public class CachifyException extends RuntimeException {
    public CachifyException(String message) {
        super(message);
    }

    public CachifyException(String message, Throwable cause) {
        super(message, cause);
    }
}
