package com.lingxiao.cachify;

/**
 * The backing store could not be reached or rejected a command. Distinct from a cache miss
 * or lock contention, which are normal results.
 */
public class StoreUnavailableException extends CachifyException {

    private final String operation;

    public StoreUnavailableException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    public StoreUnavailableException(String operation, String message) {
        super(message);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
