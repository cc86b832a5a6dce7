package com.lingxiao.cachify.execution;

import com.lingxiao.cachify.Cachify;
import com.lingxiao.cachify.codec.ValueCodec;
import com.lingxiao.cachify.key.ArgumentBinding;

abstract class AbstractCacheExecution implements CacheExecution {

    protected final Cachify cachify;
    protected final CacheSettings settings;

    protected AbstractCacheExecution(Cachify cachify, CacheSettings settings) {
        this.cachify = cachify;
        this.settings = settings;
    }

    @Override
    public String key(Object[] args) {
        return cachify.storeKey(settings.template().resolve(ArgumentBinding.of(settings.parameterNames(), args)));
    }

    protected ValueCodec codec() {
        return settings.codec() != null ? settings.codec() : cachify.codec();
    }

    protected CachifyMetrics metrics() {
        return cachify.metrics();
    }
}
