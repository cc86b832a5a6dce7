package com.lingxiao.cachify;

public class CachifyNotInitializedException extends CachifyException {
    public CachifyNotInitializedException(String message) {
        super(message);
    }
}
