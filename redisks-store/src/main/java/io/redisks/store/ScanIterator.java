package io.redisks.store;

import org.apache.kafka.streams.KeyValue;
import org.apache.kafka.streams.state.KeyValueIterator;

import java.util.NoSuchElementException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

final class ScanIterator<K, V> implements KeyValueIterator<K, V> {

    private static final long PUSH_POLL_MILLIS = 50;

    private final BlockingQueue<Notification<K, V>> queue;
    private final AtomicBoolean closed;
    private final ReentrantLock lock;
    private final AtomicBoolean released;
    private final Consumer<ScanIterator<K, V>> onRelease;

    private KeyValue<K, V> peeked;
    private boolean exhausted;

    ScanIterator(int bufferSize) {
        this(bufferSize, iterator -> {});
    }

    // onRelease runs once, when the terminal notification is consumed or on close, whichever is first
    ScanIterator(int bufferSize, Consumer<ScanIterator<K, V>> onRelease) {
        this.queue = new ArrayBlockingQueue<>(bufferSize + 1);
        this.closed = new AtomicBoolean(false);
        this.lock = new ReentrantLock();
        this.released = new AtomicBoolean(false);
        this.onRelease = onRelease;
    }

    @Override
    public boolean hasNext() {
        lock.lock();
        try {
            return advance();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public KeyValue<K, V> next() {
        lock.lock();
        try {
            if (!advance()) {
                throw new NoSuchElementException();
            }
            KeyValue<K, V> result = peeked;
            peeked = null;
            return result;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public K peekNextKey() {
        lock.lock();
        try {
            if (!advance()) {
                throw new NoSuchElementException();
            }
            return peeked.key;
        } finally {
            lock.unlock();
        }
    }

    private boolean advance() {
        if (closed.get()) {
            peeked = null;
            return false;
        }
        if (peeked != null) {
            return true;
        }
        if (exhausted) {
            return false;
        }

        Notification<K, V> notification;
        try {
            notification = queue.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }

        if (closed.get()) {
            return false;
        }
        if (notification instanceof Value<K, V> value) {
            peeked = value.entry();
            return true;
        }
        exhausted = true;
        release();
        if (notification instanceof Failed<K, V> failed) {
            throw new RedisStoreException.ScanFailed(failed.error());
        }
        return false;
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            queue.clear();
            // wakes a consumer blocked in take() on another thread
            queue.offer(new Completed<>());
            release();
        }
        if (lock.tryLock()) {
            try {
                peeked = null;
            } finally {
                lock.unlock();
            }
        }
    }

    private void release() {
        if (released.compareAndSet(false, true)) {
            onRelease.accept(this);
        }
    }

    boolean isClosed() {
        return closed.get();
    }

    boolean offer(KeyValue<K, V> entry) {
        return push(new Value<>(entry));
    }

    boolean complete() {
        return push(new Completed<>());
    }

    boolean fail(Throwable error) {
        return push(new Failed<>(error));
    }

    private boolean push(Notification<K, V> notification) {
        try {
            while (!closed.get()) {
                if (queue.offer(notification, PUSH_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                    return true;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return false;
    }

    sealed interface Notification<K, V> permits Value, Completed, Failed {}

    record Value<K, V>(KeyValue<K, V> entry) implements Notification<K, V> {}

    record Completed<K, V>() implements Notification<K, V> {}

    record Failed<K, V>(Throwable error) implements Notification<K, V> {}
}
