package io.redisks.common;

import java.time.Duration;

public interface RetryListener {

    RetryListener NOOP = new RetryListener() {
        @Override
        public void onRetry(int attempt, Throwable error, Duration delay) {}

        @Override
        public void onGiveUp(int attempts, Throwable error) {}
    };

    void onRetry(int attempt, Throwable error, Duration delay);

    void onGiveUp(int attempts, Throwable error);
}
