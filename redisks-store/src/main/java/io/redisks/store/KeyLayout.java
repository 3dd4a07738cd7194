package io.redisks.store;

import java.nio.ByteBuffer;

// value: prefix | partition | key, index set: indexKey | partition (big-endian int)
final class KeyLayout {

    static final int PARTITION_BYTES = Integer.BYTES;

    private KeyLayout() {}

    static byte[] prefixedKey(byte[] prefix, int partition, byte[] vanillaKey) {
        return ByteBuffer.allocate(prefix.length + PARTITION_BYTES + vanillaKey.length)
            .put(prefix)
            .putInt(partition)
            .put(vanillaKey)
            .array();
    }

    static byte[] indexKey(byte[] indexTemplate, int partition) {
        return ByteBuffer.allocate(indexTemplate.length + PARTITION_BYTES)
            .put(indexTemplate)
            .putInt(partition)
            .array();
    }
}
