package io.redisks.store;

import org.apache.kafka.common.serialization.Serde;

import java.util.Objects;

final class StoreCodec<K, V> {

    private final String topic;
    private final Serde<K> keySerde;
    private final Serde<V> valueSerde;

    private StoreCodec(String topic, Serde<K> keySerde, Serde<V> valueSerde) {
        this.topic = topic;
        this.keySerde = keySerde;
        this.valueSerde = valueSerde;
    }

    static <K, V> StoreCodec<K, V> fromSerdes(Serde<K> keySerde, Serde<V> valueSerde, String storeName) {
        Objects.requireNonNull(keySerde, "keySerde must not be null");
        Objects.requireNonNull(valueSerde, "valueSerde must not be null");
        return new StoreCodec<>(storeName, keySerde, valueSerde);
    }

    EncodedKey encodeKey(K key, int partition, byte[] prefix) {
        byte[] vanilla = keySerde.serializer().serialize(topic, key);
        return new EncodedKey(vanilla, KeyLayout.prefixedKey(prefix, partition, vanilla));
    }

    K decodeKey(byte[] vanillaKey) {
        return keySerde.deserializer().deserialize(topic, vanillaKey);
    }

    byte[] encodeValue(V value) {
        return valueSerde.serializer().serialize(topic, value);
    }

    V decodeValue(byte[] rawValue) {
        if (rawValue == null) {
            return null;
        }
        return valueSerde.deserializer().deserialize(topic, rawValue);
    }

    record EncodedKey(byte[] vanilla, byte[] prefixed) {}
}
