package com.lingxiao.cachify.store;

import java.util.Optional;

public record AcquireOutcome(AcquireResult result, Optional<String> token) {
    public static AcquireOutcome acquired(String token) {
        return new AcquireOutcome(AcquireResult.ACQUIRED, Optional.of(token));
    }

    public static AcquireOutcome contended() {
        return new AcquireOutcome(AcquireResult.CONTENDED, Optional.empty());
    }

    public boolean isAcquired() {
        return result == AcquireResult.ACQUIRED;
    }
}
