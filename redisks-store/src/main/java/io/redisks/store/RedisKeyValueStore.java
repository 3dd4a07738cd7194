package io.redisks.store;

import io.redisks.common.Backoff;
import io.redisks.common.Futures;
import io.redisks.common.LoggingRetryListener;
import io.redisks.common.RetriesExhaustedException;
import io.redisks.common.Retrier;
import io.redisks.common.RetrierClosedException;
import org.apache.kafka.common.serialization.Serde;
import org.apache.kafka.streams.KeyValue;
import org.apache.kafka.streams.errors.InvalidStateStoreException;
import org.apache.kafka.streams.processor.ProcessorContext;
import org.apache.kafka.streams.processor.StateStore;
import org.apache.kafka.streams.processor.StateStoreContext;
import org.apache.kafka.streams.state.KeyValueIterator;
import org.apache.kafka.streams.state.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.function.Supplier;

public final class RedisKeyValueStore<K, V> implements KeyValueStore<K, V> {

    private static final Logger log = LoggerFactory.getLogger(RedisKeyValueStore.class);

    private final String name;
    private final Supplier<RedisGateway> gatewayFactory;
    private final RedisStoreConfig config;
    private final Serde<K> keySerde;
    private final Serde<V> valueSerde;
    private final Comparator<K> keyComparator;
    private final ReentrantLock lock;
    private final Set<ScanIterator<K, V>> openIterators;

    private volatile Session<K, V> session;

    RedisKeyValueStore(
        String name,
        Supplier<RedisGateway> gatewayFactory,
        RedisStoreConfig config,
        Serde<K> keySerde,
        Serde<V> valueSerde,
        Comparator<K> keyComparator
    ) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.gatewayFactory = Objects.requireNonNull(gatewayFactory, "gatewayFactory must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.keySerde = keySerde;
        this.valueSerde = valueSerde;
        this.keyComparator = Objects.requireNonNull(keyComparator, "keyComparator must not be null");
        this.lock = new ReentrantLock();
        this.openIterators = ConcurrentHashMap.newKeySet();
    }

    @Override
    public String name() {
        return name;
    }

    @Deprecated
    @Override
    public void init(ProcessorContext context, StateStore root) {
        if (root != null) {
            context.register(root, (key, value) -> {});
        }
        open(context.taskId().partition(), typed(context.keySerde()), typed(context.valueSerde()));
    }

    @Override
    public void init(StateStoreContext context, StateStore root) {
        if (root != null) {
            context.register(root, (key, value) -> {});
        }
        open(context.taskId().partition(), typed(context.keySerde()), typed(context.valueSerde()));
    }

    // context serdes are untyped; a mismatch surfaces on first use
    private static <T> Serde<T> typed(Serde<?> serde) {
        return (Serde<T>) serde;
    }

    void open(int partition, Serde<K> contextKeySerde, Serde<V> contextValueSerde) {
        lock.lock();
        try {
            if (session != null) {
                throw new IllegalStateException("Store " + name + " is already open");
            }
            StoreCodec<K, V> codec = StoreCodec.fromSerdes(
                keySerde != null ? keySerde : contextKeySerde,
                valueSerde != null ? valueSerde : contextValueSerde,
                name
            );

            RedisGateway gateway = gatewayFactory.get();
            ScheduledExecutorService retryScheduler =
                Executors.newSingleThreadScheduledExecutor(daemonThreads("redisks-retry-" + name));
            ExecutorService scanExecutor = Executors.newCachedThreadPool(daemonThreads("redisks-scan-" + name));
            Retrier retrier = new Retrier(new Backoff(config.backoff()), retryScheduler, new LoggingRetryListener(log));

            Map<Script, String> digests;
            try {
                digests = loadScripts(gateway, retrier);
            } catch (RuntimeException e) {
                retryScheduler.shutdownNow();
                scanExecutor.shutdownNow();
                gateway.close();
                throw e;
            }

            session = new Session<>(
                gateway,
                codec,
                retrier,
                retryScheduler,
                scanExecutor,
                partition,
                KeyLayout.indexKey(config.indexKey(), partition),
                digests
            );
            log.info("Opened store {} for partition {}", name, partition);
        } finally {
            lock.unlock();
        }
    }

    private static Map<Script, String> loadScripts(RedisGateway gateway, Retrier retrier) {
        Map<Script, String> digests = new EnumMap<>(Script.class);
        for (Script script : Script.values()) {
            try {
                digests.put(script, retrier.execute(() -> gateway.scriptLoad(script.body())).join());
            } catch (CompletionException | CancellationException e) {
                throw new RedisStoreException.ScriptLoadFailed(script.resource(), Futures.unwrap(e));
            }
        }
        return digests;
    }

    @Override
    public void flush() {
        Session<K, V> current = session;
        if (current != null) {
            current.gateway().flushCommands();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            Session<K, V> current = session;
            if (current == null) {
                return;
            }
            session = null;
            for (ScanIterator<K, V> iterator : List.copyOf(openIterators)) {
                iterator.close();
            }
            current.retrier().close();
            current.retryScheduler().shutdownNow();
            current.scanExecutor().shutdownNow();
            current.gateway().close();
            log.info("Closed store {} for partition {}", name, current.partition());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean persistent() {
        return true;
    }

    @Override
    public boolean isOpen() {
        return session != null;
    }

    @Override
    public V get(K key) {
        Objects.requireNonNull(key, "key cannot be null");
        Session<K, V> s = session();
        byte[] prefixedKey = s.encodeKey(key, config).prefixed();
        byte[] rawValue = await(s.retrier().execute(() -> s.gateway().get(prefixedKey)), "get");
        return s.codec().decodeValue(rawValue);
    }

    @Override
    public void put(K key, V value) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        Session<K, V> s = session();
        StoreCodec.EncodedKey encoded = s.encodeKey(key, config);
        byte[] rawValue = s.codec().encodeValue(value);
        byte[][] keys = {encoded.prefixed(), s.indexKey()};
        s.retrier()
            .execute(() -> s.gateway().evalStatus(s.digest(Script.PUT), keys, rawValue, encoded.vanilla()))
            .whenComplete((ignored, error) -> {
                if (error != null) {
                    log.error("Failed to put key into store {}", name, Futures.unwrap(error));
                }
            });
    }

    @Override
    public V putIfAbsent(K key, V value) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        Session<K, V> s = session();
        StoreCodec.EncodedKey encoded = s.encodeKey(key, config);
        byte[] rawValue = s.codec().encodeValue(value);
        byte[][] keys = {encoded.prefixed(), s.indexKey()};
        byte[] previous = await(
            s.retrier().execute(() ->
                s.gateway().evalValue(s.digest(Script.PUT_IF_ABSENT), keys, rawValue, encoded.vanilla())),
            "putIfAbsent");
        return s.codec().decodeValue(previous);
    }

    // MSET then SADD, not atomic: values whose SADD never succeeds are invisible to scans
    @Override
    public void putAll(List<KeyValue<K, V>> entries) {
        Objects.requireNonNull(entries, "entries cannot be null");
        Session<K, V> s = session();
        if (entries.isEmpty()) {
            return;
        }
        Map<byte[], byte[]> values = new LinkedHashMap<>();
        List<byte[]> vanillaKeys = new ArrayList<>(entries.size());
        for (KeyValue<K, V> entry : entries) {
            Objects.requireNonNull(entry.key, "key cannot be null");
            Objects.requireNonNull(entry.value, "value cannot be null");
            StoreCodec.EncodedKey encoded = s.encodeKey(entry.key, config);
            values.put(encoded.prefixed(), s.codec().encodeValue(entry.value));
            vanillaKeys.add(encoded.vanilla());
        }

        s.retrier()
            .execute(() -> s.gateway().mset(values))
            .thenCompose(ignored -> s.retrier().execute(() -> s.gateway().sadd(s.indexKey(), vanillaKeys)))
            .whenComplete((added, error) -> {
                if (error != null) {
                    log.error("Failed to put {} entries into store {}; values may be missing from the index",
                        entries.size(), name, Futures.unwrap(error));
                }
            });
    }

    @Override
    public V delete(K key) {
        Objects.requireNonNull(key, "key cannot be null");
        Session<K, V> s = session();
        StoreCodec.EncodedKey encoded = s.encodeKey(key, config);
        byte[][] keys = {encoded.prefixed(), s.indexKey()};
        byte[] previous = await(
            s.retrier().execute(() -> s.gateway().evalValue(s.digest(Script.DELETE), keys, encoded.vanilla())),
            "delete");
        return s.codec().decodeValue(previous);
    }

    // unordered; null bounds are open
    @Override
    public KeyValueIterator<K, V> range(K from, K to) {
        session();
        if (from != null && to != null && keyComparator.compare(from, to) > 0) {
            log.warn("Returning empty iterator for range query on store {} with from > to", name);
            ScanIterator<K, V> empty = new ScanIterator<>(0);
            empty.complete();
            return empty;
        }
        return scan(key -> (from == null || keyComparator.compare(from, key) <= 0)
            && (to == null || keyComparator.compare(key, to) <= 0));
    }

    @Override
    public KeyValueIterator<K, V> all() {
        return scan(key -> true);
    }

    private KeyValueIterator<K, V> scan(Predicate<K> predicate) {
        Session<K, V> s = session();
        ScanIterator<K, V> iterator = new ScanIterator<>(config.scanPageSize(), openIterators::remove);
        openIterators.add(iterator);
        new IndexScan<>(
            s.gateway(),
            s.retrier(),
            s.scanExecutor(),
            s.codec(),
            config.keyPrefix(),
            s.indexKey(),
            s.partition(),
            config.scanPageSize(),
            predicate,
            iterator
        ).start();
        return iterator;
    }

    @Override
    public long approximateNumEntries() {
        Session<K, V> s = session();
        Long count = await(s.retrier().execute(() -> s.gateway().scard(s.indexKey())), "approximateNumEntries");
        return count == null ? 0L : count;
    }

    int openIteratorCount() {
        return openIterators.size();
    }

    private Session<K, V> session() {
        Session<K, V> current = session;
        if (current == null) {
            throw new InvalidStateStoreException("Store " + name + " is currently closed");
        }
        return current;
    }

    private <T> T await(CompletableFuture<T> future, String operation) {
        try {
            return future.join();
        } catch (CompletionException | CancellationException e) {
            Throwable cause = Futures.unwrap(e);
            if (cause instanceof RetrierClosedException) {
                throw new InvalidStateStoreException("Store " + name + " was closed during " + operation);
            }
            if (cause instanceof RuntimeException runtime && !(cause instanceof RetriesExhaustedException)) {
                throw runtime;
            }
            throw new RedisStoreException.OperationFailed(operation, cause);
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private record Session<K, V>(
        RedisGateway gateway,
        StoreCodec<K, V> codec,
        Retrier retrier,
        ScheduledExecutorService retryScheduler,
        ExecutorService scanExecutor,
        int partition,
        byte[] indexKey,
        Map<Script, String> digests
    ) {
        StoreCodec.EncodedKey encodeKey(K key, RedisStoreConfig config) {
            return codec.encodeKey(key, partition, config.keyPrefix());
        }

        String digest(Script script) {
            return digests.get(script);
        }
    }
}
