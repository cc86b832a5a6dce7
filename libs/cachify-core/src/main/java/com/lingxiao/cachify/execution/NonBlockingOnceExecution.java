package com.lingxiao.cachify.execution;

import com.lingxiao.cachify.Cachify;
import com.lingxiao.cachify.StoreFailurePolicy;
import com.lingxiao.cachify.StoreUnavailableException;
import com.lingxiao.cachify.store.AcquireOutcome;
import com.lingxiao.cachify.store.AsyncCacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Releases the lock when the wrapped stage settles, including when the caller cancels the
 * returned future: cancellation is forwarded to the wrapped stage and the release still runs
 * before the returned future completes. Store callbacks hop to the call executor before the
 * wrapped function runs or the returned future completes.
 */
public class NonBlockingOnceExecution extends AbstractOnceExecution {

    private static final Logger log = LoggerFactory.getLogger(NonBlockingOnceExecution.class);

    public NonBlockingOnceExecution(Cachify cachify, OnceSettings settings) {
        super(cachify, settings);
    }

    @Override
    public CallMode mode() {
        return CallMode.NON_BLOCKING;
    }

    @Override
    public CompletableFuture<Object> call(Object[] args, Invocation invocation) {
        String key;
        AsyncCacheStore store;
        try {
            key = key(args);
            store = cachify.nonBlockingStore();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }

        CompletableFuture<Object> result = new CompletableFuture<>();
        store.tryAcquire(key, settings.ttl()).handleAsync((outcome, ex) -> {
            if (ex != null) {
                onAcquireFailure(key, args, invocation, Futures.unwrap(ex), result);
            } else if (!outcome.isAcquired()) {
                onContended(key, args, result);
            } else {
                runLocked(store, key, outcome, args, invocation, result);
            }
            return null;
        }, cachify.callExecutor()).exceptionally(ex -> {
            result.completeExceptionally(Futures.unwrap(ex));
            return null;
        });
        return result;
    }

    private void runLocked(AsyncCacheStore store, String key, AcquireOutcome outcome, Object[] args,
                           Invocation invocation, CompletableFuture<Object> result) {
        String token = outcome.token().orElseThrow();
        metrics().lockAcquired(settings.name());
        if (result.isDone()) {
            log.debug("Caller gave up before lock was acquired, releasing key={}", key);
            release(store, key, token);
            return;
        }
        log.debug("Lock acquired key={}", key);
        CompletableFuture<Object> call = Futures.invoke(invocation, args);
        result.whenComplete((value, ex) -> {
            if (result.isCancelled()) {
                call.cancel(true);
            }
        });
        call.whenComplete((value, failure) -> release(store, key, token).whenCompleteAsync((released, ignored) -> {
            if (failure != null) {
                result.completeExceptionally(Futures.unwrap(failure));
            } else {
                result.complete(value);
            }
        }, cachify.callExecutor()));
    }

    private void onContended(String key, Object[] args, CompletableFuture<Object> result) {
        metrics().lockContended(settings.name());
        log.debug("Lock contended key={}", key);
        try {
            result.complete(settings.contentionPolicy().onContended(key, args));
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
        }
    }

    private void onAcquireFailure(String key, Object[] args, Invocation invocation, Throwable cause,
                                  CompletableFuture<Object> result) {
        if (cause instanceof StoreUnavailableException) {
            metrics().storeError(settings.name(), "acquire");
            if (settings.storeFailurePolicy() == StoreFailurePolicy.FAIL_OPEN) {
                log.warn("Lock store unavailable, calling through without lock key={}", key, cause);
                Futures.invoke(invocation, args).whenComplete((value, failure) -> {
                    if (failure != null) {
                        result.completeExceptionally(Futures.unwrap(failure));
                    } else {
                        result.complete(value);
                    }
                });
                return;
            }
        }
        result.completeExceptionally(cause);
    }

    private CompletableFuture<Boolean> release(AsyncCacheStore store, String key, String token) {
        CompletableFuture<Boolean> released;
        try {
            released = store.release(key, token);
        } catch (RuntimeException e) {
            released = CompletableFuture.failedFuture(e);
        }
        return released.handle((ok, ex) -> {
            if (ex != null) {
                metrics().storeError(settings.name(), "release");
                log.warn("Lock release failed, store reclaims it after ttl key={} ttl={}", key, settings.ttl(),
                        Futures.unwrap(ex));
                return false;
            }
            if (!Boolean.TRUE.equals(ok)) {
                log.warn("Lock expired before release, exclusivity may have been lost key={} ttl={}", key, settings.ttl());
            }
            return Boolean.TRUE.equals(ok);
        });
    }
}
