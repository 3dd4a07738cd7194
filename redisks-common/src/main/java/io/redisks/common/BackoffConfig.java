package io.redisks.common;

import java.time.Duration;
import java.util.Objects;

public record BackoffConfig(
    Duration initialDelay,
    Duration maxDelay,
    int maxAttempts,
    Duration maxElapsed
) {
    public BackoffConfig {
        Objects.requireNonNull(initialDelay, "initialDelay must not be null");
        Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        Objects.requireNonNull(maxElapsed, "maxElapsed must not be null");
        if (initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must be non-negative");
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= initialDelay");
        }
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be non-negative");
        }
        if (maxElapsed.isNegative()) {
            throw new IllegalArgumentException("maxElapsed must be non-negative");
        }
    }

    public static BackoffConfig create() {
        return new BackoffConfig(
            Duration.ofSeconds(1),
            Duration.ofSeconds(60),
            100_000,
            Duration.ofMinutes(10)
        );
    }
}
