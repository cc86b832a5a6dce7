package com.lingxiao.cachify.function;

import java.util.concurrent.CompletionStage;

@FunctionalInterface
public interface NonBlockingCall<R> {
    CompletionStage<R> call(Object[] args) throws Exception;
}
