package io.redisks.common;

import org.slf4j.Logger;

import java.time.Duration;
import java.util.Objects;

public final class LoggingRetryListener implements RetryListener {

    private final Logger log;

    public LoggingRetryListener(Logger log) {
        this.log = Objects.requireNonNull(log, "log must not be null");
    }

    @Override
    public void onRetry(int attempt, Throwable error, Duration delay) {
        log.warn("Attempt {} failed with {}: {}. Retrying in {} ms",
            attempt, error.getClass().getSimpleName(), error.getMessage(), delay.toMillis());
    }

    @Override
    public void onGiveUp(int attempts, Throwable error) {
        log.warn("Retry with backoff failed after {} attempts, giving up. {}: {}",
            attempts, error.getClass().getSimpleName(), error.getMessage());
    }
}
