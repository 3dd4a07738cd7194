package io.redisks.common;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.function.LongSupplier;
import java.util.function.Predicate;
import java.util.function.Supplier;

public final class Retrier {

    private final Backoff backoff;
    private final ScheduledExecutorService scheduler;
    private final RetryListener listener;
    private final Predicate<Throwable> retryable;
    private final LongSupplier ticker;
    private final Set<CompletableFuture<?>> pending;

    private volatile boolean closed;

    public Retrier(Backoff backoff, ScheduledExecutorService scheduler, RetryListener listener) {
        this(backoff, scheduler, listener, Retrier::isRetryable, System::nanoTime);
    }

    public Retrier(
        Backoff backoff,
        ScheduledExecutorService scheduler,
        RetryListener listener,
        Predicate<Throwable> retryable,
        LongSupplier ticker
    ) {
        this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
        this.retryable = Objects.requireNonNull(retryable, "retryable must not be null");
        this.ticker = Objects.requireNonNull(ticker, "ticker must not be null");
        this.pending = ConcurrentHashMap.newKeySet();
    }

    public <T> CompletableFuture<T> execute(Supplier<CompletableFuture<T>> operation) {
        return execute(operation, () -> false);
    }

    public <T> CompletableFuture<T> execute(Supplier<CompletableFuture<T>> operation, BooleanSupplier cancelled) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(cancelled, "cancelled must not be null");
        CompletableFuture<T> result = new CompletableFuture<>();
        pending.add(result);
        result.whenComplete((value, error) -> pending.remove(result));
        // re-checked after registering so a concurrent close() cannot miss the result
        if (closed) {
            result.completeExceptionally(new RetrierClosedException());
            return result;
        }
        attempt(operation, cancelled, result, 0, 0L);
        return result;
    }

    // fails every result that has not completed yet, including those waiting on a scheduled retry
    public void close() {
        closed = true;
        for (CompletableFuture<?> result : List.copyOf(pending)) {
            result.completeExceptionally(new RetrierClosedException());
        }
    }

    public boolean isClosed() {
        return closed;
    }

    int pendingCount() {
        return pending.size();
    }

    private <T> void attempt(
        Supplier<CompletableFuture<T>> operation,
        BooleanSupplier cancelled,
        CompletableFuture<T> result,
        int failures,
        long firstFailureNanos
    ) {
        if (result.isDone()) {
            return;
        }
        CompletableFuture<T> call;
        try {
            call = operation.get();
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }
        call.whenComplete((value, error) -> {
            if (error == null) {
                result.complete(value);
            } else {
                onFailure(operation, cancelled, result, Futures.unwrap(error), failures + 1, firstFailureNanos);
            }
        });
    }

    private <T> void onFailure(
        Supplier<CompletableFuture<T>> operation,
        BooleanSupplier cancelled,
        CompletableFuture<T> result,
        Throwable error,
        int attempt,
        long firstFailureNanos
    ) {
        if (!retryable.test(error)) {
            result.completeExceptionally(error);
            return;
        }
        long now = ticker.getAsLong();
        long firstFailure = attempt == 1 ? now : firstFailureNanos;
        if (cancelled.getAsBoolean()) {
            result.cancel(false);
            return;
        }
        if (closed) {
            result.completeExceptionally(new RetrierClosedException());
            return;
        }

        Backoff.Decision decision = backoff.decide(attempt, Duration.ofNanos(now - firstFailure));
        if (decision instanceof Backoff.Retry retry) {
            listener.onRetry(attempt, error, retry.delay());
            try {
                scheduler.schedule(() -> {
                    if (cancelled.getAsBoolean()) {
                        result.cancel(false);
                    } else {
                        attempt(operation, cancelled, result, attempt, firstFailure);
                    }
                }, retry.delay().toNanos(), TimeUnit.NANOSECONDS);
            } catch (RejectedExecutionException e) {
                error.addSuppressed(e);
                result.completeExceptionally(new RetriesExhaustedException(attempt, error));
            }
        } else {
            listener.onGiveUp(attempt, error);
            result.completeExceptionally(new RetriesExhaustedException(attempt, error));
        }
    }

    public static boolean isRetryable(Throwable error) {
        return !(error instanceof NullPointerException
            || error instanceof IllegalArgumentException
            || error instanceof IllegalStateException
            || error instanceof UnsupportedOperationException);
    }
}
