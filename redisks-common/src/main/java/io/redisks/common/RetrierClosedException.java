package io.redisks.common;

public final class RetrierClosedException extends RuntimeException {

    public RetrierClosedException() {
        super("Retrier is closed");
    }
}
