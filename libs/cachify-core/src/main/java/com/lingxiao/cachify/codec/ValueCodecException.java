package com.lingxiao.cachify.codec;

import com.lingxiao.cachify.CachifyException;

public class ValueCodecException extends CachifyException {
    public ValueCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
