package com.lingxiao.cachify.autoconfigure;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "cachify")
public class CachifyProperties {

    private boolean enabled = true;

    // prepended to every cache and lock key
    private String keyPrefix = "cachify:";

    private final Cache cache = new Cache();
    private final Lock lock = new Lock();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getKeyPrefix() {
        return keyPrefix;
    }

    public void setKeyPrefix(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    public Cache getCache() {
        return cache;
    }

    public Lock getLock() {
        return lock;
    }

    public static class Cache {
        /**
         * Serve calls through the wrapped function when the store fails on lookup or write.
         */
        private boolean degradeOnStoreError = true;

        public boolean isDegradeOnStoreError() {
            return degradeOnStoreError;
        }

        public void setDegradeOnStoreError(boolean degradeOnStoreError) {
            this.degradeOnStoreError = degradeOnStoreError;
        }
    }

    public static class Lock {
        private Duration defaultTtl = Duration.ofSeconds(30);
        private Duration pollInterval = Duration.ofMillis(100);

        public Duration getDefaultTtl() {
            return defaultTtl;
        }

        public void setDefaultTtl(Duration defaultTtl) {
            this.defaultTtl = defaultTtl;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }
    }
}
