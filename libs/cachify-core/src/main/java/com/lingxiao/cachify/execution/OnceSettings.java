package com.lingxiao.cachify.execution;

import com.lingxiao.cachify.StoreFailurePolicy;
import com.lingxiao.cachify.key.KeyTemplate;

import java.time.Duration;

public record OnceSettings(String name,
                           KeyTemplate template,
                           String[] parameterNames,
                           Duration ttl,
                           ContentionPolicy contentionPolicy,
                           StoreFailurePolicy storeFailurePolicy) {
    public OnceSettings {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("Lock ttl must be positive, template=" + template);
        }
        if (contentionPolicy == null) {
            throw new IllegalArgumentException("Contention policy is required, template=" + template);
        }
        if (storeFailurePolicy == null) {
            storeFailurePolicy = StoreFailurePolicy.FAIL_CLOSED;
        }
    }
}
