package io.redisks.common;

import java.time.Duration;
import java.util.Objects;

public final class Backoff {

    private final BackoffConfig config;

    public Backoff(BackoffConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    public BackoffConfig config() {
        return config;
    }

    public Duration delayFor(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1, got " + attempt);
        }
        long initial = config.initialDelay().toNanos();
        long max = config.maxDelay().toNanos();
        int shift = attempt - 1;
        if (shift >= Long.SIZE - 2 || initial > (max >> shift)) {
            return config.maxDelay();
        }
        return Duration.ofNanos(initial << shift);
    }

    public Decision decide(int attempt, Duration elapsed) {
        if (attempt > config.maxAttempts() || elapsed.compareTo(config.maxElapsed()) > 0) {
            return new GiveUp();
        }
        return new Retry(delayFor(attempt));
    }

    public sealed interface Decision permits Retry, GiveUp {}

    public record Retry(Duration delay) implements Decision {}

    public record GiveUp() implements Decision {}
}
