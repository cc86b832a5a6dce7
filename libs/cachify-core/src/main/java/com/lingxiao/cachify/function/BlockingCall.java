package com.lingxiao.cachify.function;

@FunctionalInterface
public interface BlockingCall<R> {
    R call(Object[] args) throws Exception;
}
