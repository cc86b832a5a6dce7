package com.lingxiao.cachify.redis;

import com.lingxiao.cachify.StoreUnavailableException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.RedisSystemException;

/**
 * Maps Redis client failures onto {@link StoreUnavailableException}, keeping the command name.
 */
public class RedisErrorTranslator {

    public StoreUnavailableException translate(String operation, String key, Throwable throwable) {
        if (throwable instanceof StoreUnavailableException storeEx) {
            return storeEx;
        }
        if (throwable instanceof RedisConnectionFailureException) {
            return new StoreUnavailableException(operation, "redis connection failed op=" + operation + " key=" + key, throwable);
        }
        if (throwable instanceof QueryTimeoutException) {
            return new StoreUnavailableException(operation, "redis timeout op=" + operation + " key=" + key, throwable);
        }
        if (throwable instanceof RedisSystemException) {
            return new StoreUnavailableException(operation, "redis command rejected op=" + operation + " key=" + key, throwable);
        }
        if (throwable instanceof DataAccessException) {
            return new StoreUnavailableException(operation, "redis error op=" + operation + " key=" + key, throwable);
        }
        return new StoreUnavailableException(operation, "store error op=" + operation + " key=" + key, throwable);
    }
}
