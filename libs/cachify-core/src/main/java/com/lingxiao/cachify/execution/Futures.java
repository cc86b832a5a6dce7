package com.lingxiao.cachify.execution;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

final class Futures {

    private Futures() {
    }

    static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    static CompletionException rethrow(Throwable t) {
        return t instanceof CompletionException ce ? ce : new CompletionException(t);
    }

    @SuppressWarnings("unchecked")
    static CompletableFuture<Object> invoke(Invocation invocation, Object[] args) {
        try {
            Object stage = invocation.proceed(args);
            if (stage == null) {
                return CompletableFuture.completedFuture(null);
            }
            return ((CompletionStage<Object>) stage).toCompletableFuture();
        } catch (Throwable t) {
            return CompletableFuture.failedFuture(t);
        }
    }
}
