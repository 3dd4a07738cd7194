package io.redisks.store;

import io.lettuce.core.RedisClient;
import org.apache.kafka.common.serialization.Serde;
import org.apache.kafka.streams.state.KeyValueStore;
import org.apache.kafka.streams.state.StoreBuilder;

import java.util.Collections;
import java.util.Comparator;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

public final class RedisStoreBuilder<K, V> implements StoreBuilder<KeyValueStore<K, V>> {

    private final String name;
    private Supplier<RedisGateway> gatewayFactory;
    private RedisStoreConfig config;
    private Serde<K> keySerde;
    private Serde<V> valueSerde;
    private Comparator<K> keyComparator;

    private RedisStoreBuilder(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.config = RedisStoreConfig.create(name);
    }

    public static <K, V> RedisStoreBuilder<K, V> create(String name) {
        return new RedisStoreBuilder<>(name);
    }

    public RedisStoreBuilder<K, V> withRedisClient(RedisClient client) {
        Objects.requireNonNull(client, "client must not be null");
        this.gatewayFactory = () -> LettuceRedisGateway.connect(client);
        return this;
    }

    public RedisStoreBuilder<K, V> withGateway(Supplier<RedisGateway> gatewayFactory) {
        this.gatewayFactory = Objects.requireNonNull(gatewayFactory, "gatewayFactory must not be null");
        return this;
    }

    public RedisStoreBuilder<K, V> withConfig(RedisStoreConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        return this;
    }

    public RedisStoreBuilder<K, V> withKeySerde(Serde<K> keySerde) {
        this.keySerde = keySerde;
        return this;
    }

    public RedisStoreBuilder<K, V> withValueSerde(Serde<V> valueSerde) {
        this.valueSerde = valueSerde;
        return this;
    }

    public RedisStoreBuilder<K, V> withKeyComparator(Comparator<K> keyComparator) {
        this.keyComparator = keyComparator;
        return this;
    }

    @Override
    public RedisStoreBuilder<K, V> withCachingEnabled() {
        throw new UnsupportedOperationException("Redis stores do not support record caching");
    }

    @Override
    public RedisStoreBuilder<K, V> withCachingDisabled() {
        return this;
    }

    @Override
    public RedisStoreBuilder<K, V> withLoggingEnabled(Map<String, String> config) {
        throw new UnsupportedOperationException("Redis stores are durable and do not use a changelog topic");
    }

    @Override
    public RedisStoreBuilder<K, V> withLoggingDisabled() {
        return this;
    }

    @Override
    public RedisKeyValueStore<K, V> build() {
        if (gatewayFactory == null) {
            throw new IllegalStateException("A Redis client or gateway must be configured for store " + name);
        }
        Comparator<K> comparator = keyComparator != null ? keyComparator : naturalOrder();
        return new RedisKeyValueStore<>(name, gatewayFactory, config, keySerde, valueSerde, comparator);
    }

    // keys that are not Comparable only fail once a range query compares them
    private static <K> Comparator<K> naturalOrder() {
        return (Comparator<K>) (Comparator<?>) Comparator.naturalOrder();
    }

    @Override
    public Map<String, String> logConfig() {
        return Collections.emptyMap();
    }

    @Override
    public boolean loggingEnabled() {
        return false;
    }

    @Override
    public String name() {
        return name;
    }
}
