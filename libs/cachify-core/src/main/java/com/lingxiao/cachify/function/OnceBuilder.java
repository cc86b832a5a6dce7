package com.lingxiao.cachify.function;

import com.lingxiao.cachify.Cachify;
import com.lingxiao.cachify.StoreFailurePolicy;
import com.lingxiao.cachify.execution.CallMode;
import com.lingxiao.cachify.execution.ContentionPolicy;
import com.lingxiao.cachify.execution.OnceExecution;
import com.lingxiao.cachify.execution.OnceSettings;
import com.lingxiao.cachify.key.KeyTemplate;

import java.time.Duration;
import java.util.List;

/**
 * Builds lock-guarded functions. The TTL bounds how long a crashed holder blocks the key;
 * there is no renewal, so a call outliving its TTL can overlap with the next holder.
 */
public final class OnceBuilder {

    private final Cachify cachify;
    private final KeyTemplate template;
    private Duration ttl;
    private String[] parameterNames = new String[0];
    private ContentionPolicy contentionPolicy = ContentionPolicy.returning(null);
    private StoreFailurePolicy storeFailurePolicy = StoreFailurePolicy.FAIL_CLOSED;
    private String name;

    public OnceBuilder(Cachify cachify, String keyTemplate) {
        this.cachify = cachify;
        this.template = KeyTemplate.parse(keyTemplate);
    }

    public OnceBuilder ttl(Duration ttl) {
        this.ttl = ttl;
        return this;
    }

    public OnceBuilder parameters(String... names) {
        this.parameterNames = names.clone();
        return this;
    }

    public OnceBuilder onContended(ContentionPolicy contentionPolicy) {
        this.contentionPolicy = contentionPolicy;
        return this;
    }

    public OnceBuilder onStoreUnavailable(StoreFailurePolicy storeFailurePolicy) {
        this.storeFailurePolicy = storeFailurePolicy;
        return this;
    }

    public OnceBuilder name(String name) {
        this.name = name;
        return this;
    }

    public <R> OnceFunction<R> blocking(BlockingCall<R> call) {
        return new OnceFunction<>(execution(CallMode.BLOCKING), call);
    }

    public <R> AsyncOnceFunction<R> nonBlocking(NonBlockingCall<R> call) {
        return new AsyncOnceFunction<>(execution(CallMode.NON_BLOCKING), call);
    }

    private OnceExecution execution(CallMode mode) {
        template.validateAgainst(List.of(parameterNames));
        OnceSettings settings = new OnceSettings(
                name != null ? name : template.source(),
                template,
                parameterNames,
                ttl != null ? ttl : cachify.defaultLockTtl(),
                contentionPolicy,
                storeFailurePolicy);
        return mode.onceExecution(cachify, settings);
    }
}
