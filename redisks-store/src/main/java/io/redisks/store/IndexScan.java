package io.redisks.store;

import io.redisks.common.Futures;
import io.redisks.common.Retrier;
import io.redisks.common.RetrierClosedException;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.streams.KeyValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Executor;
import java.util.function.Predicate;

final class IndexScan<K, V> {

    private static final Logger log = LoggerFactory.getLogger(IndexScan.class);

    private final RedisGateway gateway;
    private final Retrier retrier;
    private final Executor executor;
    private final StoreCodec<K, V> codec;
    private final byte[] keyPrefix;
    private final byte[] indexKey;
    private final int partition;
    private final int pageSize;
    private final Predicate<K> predicate;
    private final ScanIterator<K, V> sink;

    IndexScan(
        RedisGateway gateway,
        Retrier retrier,
        Executor executor,
        StoreCodec<K, V> codec,
        byte[] keyPrefix,
        byte[] indexKey,
        int partition,
        int pageSize,
        Predicate<K> predicate,
        ScanIterator<K, V> sink
    ) {
        this.gateway = gateway;
        this.retrier = retrier;
        this.executor = executor;
        this.codec = codec;
        this.keyPrefix = keyPrefix;
        this.indexKey = indexKey;
        this.partition = partition;
        this.pageSize = pageSize;
        this.predicate = predicate;
        this.sink = sink;
    }

    void start() {
        requestPage(null);
    }

    private void requestPage(IndexPage previous) {
        retrier.execute(() -> gateway.sscan(indexKey, previous, pageSize), sink::isClosed)
            .whenCompleteAsync((page, error) -> {
                if (error != null) {
                    onError(error);
                } else {
                    guarded(() -> onPage(page));
                }
            }, executor);
    }

    private void onPage(IndexPage page) {
        List<K> keys = new ArrayList<>(page.members().size());
        List<byte[]> rawKeys = new ArrayList<>(page.members().size());
        for (byte[] member : page.members()) {
            K key;
            try {
                key = codec.decodeKey(member);
            } catch (SerializationException e) {
                log.warn("Skipping undecodable index member in partition {}: {}", partition, e.getMessage());
                continue;
            }
            if (key != null && predicate.test(key)) {
                keys.add(key);
                rawKeys.add(KeyLayout.prefixedKey(keyPrefix, partition, member));
            }
        }

        if (keys.isEmpty()) {
            continueAfter(page);
            return;
        }

        retrier.execute(() -> gateway.mget(rawKeys), sink::isClosed)
            .whenCompleteAsync((values, error) -> {
                if (error != null) {
                    onError(error);
                } else {
                    guarded(() -> {
                        deliver(keys, values);
                        continueAfter(page);
                    });
                }
            }, executor);
    }

    private void deliver(List<K> keys, List<byte[]> values) {
        if (values.size() != keys.size()) {
            throw new IllegalStateException(
                "MGET returned %d values for %d keys".formatted(values.size(), keys.size()));
        }
        for (int i = 0; i < keys.size(); i++) {
            if (sink.isClosed()) {
                return;
            }
            byte[] rawValue = values.get(i);
            if (rawValue == null) {
                log.debug("Key in index of partition {} has no value, skipping", partition);
                continue;
            }
            sink.offer(new KeyValue<>(keys.get(i), codec.decodeValue(rawValue)));
        }
    }

    // the next SSCAN is only issued once the current page has been handed over
    private void continueAfter(IndexPage page) {
        if (page.finished() || sink.isClosed()) {
            sink.complete();
        } else {
            requestPage(page);
        }
    }

    private void guarded(Runnable step) {
        try {
            step.run();
        } catch (RuntimeException e) {
            onError(e);
        }
    }

    private void onError(Throwable error) {
        Throwable cause = Futures.unwrap(error);
        if (cause instanceof CancellationException) {
            log.debug("Scan of partition {} cancelled after iterator was closed", partition);
            return;
        }
        if (cause instanceof RetrierClosedException) {
            log.debug("Scan of partition {} stopped because the store was closed", partition);
            sink.complete();
            return;
        }
        log.warn("Scan of partition {} failed", partition, cause);
        sink.fail(cause);
    }
}
