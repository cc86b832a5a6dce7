package com.lingxiao.cachify.execution;

import com.lingxiao.cachify.Cachify;
import com.lingxiao.cachify.key.ArgumentBinding;

abstract class AbstractOnceExecution implements OnceExecution {

    protected final Cachify cachify;
    protected final OnceSettings settings;

    protected AbstractOnceExecution(Cachify cachify, OnceSettings settings) {
        this.cachify = cachify;
        this.settings = settings;
    }

    @Override
    public String key(Object[] args) {
        return cachify.storeKey(settings.template().resolve(ArgumentBinding.of(settings.parameterNames(), args)));
    }

    protected CachifyMetrics metrics() {
        return cachify.metrics();
    }
}
