package com.kmg.ocrbatch.config;

import java.time.Duration;
import java.util.Objects;

public record RetrySettings(int maxAttempts, Duration baseDelay, Duration maxDelay, double jitterFactor) {
    public RetrySettings {
        Objects.requireNonNull(baseDelay, "baseDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1 (current: " + maxAttempts + ")");
        }
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must not be negative (current: " + baseDelay + ")");
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay (base: " + baseDelay + ", max: " + maxDelay + ")");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")");
        }
    }

    public static RetrySettings defaults() {
        return new RetrySettings(3, Duration.ofSeconds(1), Duration.ofSeconds(30), 0.0);
    }
}
