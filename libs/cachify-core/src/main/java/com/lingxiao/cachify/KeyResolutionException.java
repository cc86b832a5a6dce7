package com.lingxiao.cachify;

/**
 * A key template could not be rendered from the call arguments. Always a caller or
 * configuration bug; never recovered automatically.
 */
public class KeyResolutionException extends CachifyException {
    public KeyResolutionException(String message) {
        super(message);
    }

    public KeyResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
