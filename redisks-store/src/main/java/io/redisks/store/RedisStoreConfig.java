package io.redisks.store;

import io.redisks.common.BackoffConfig;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

public record RedisStoreConfig(
    byte[] keyPrefix,
    byte[] indexKey,
    int scanPageSize,
    BackoffConfig backoff
) {
    public static final int DEFAULT_SCAN_PAGE_SIZE = 50;

    public RedisStoreConfig {
        Objects.requireNonNull(keyPrefix, "keyPrefix must not be null");
        Objects.requireNonNull(indexKey, "indexKey must not be null");
        Objects.requireNonNull(backoff, "backoff must not be null");
        if (Arrays.equals(keyPrefix, indexKey)) {
            throw new IllegalArgumentException("keyPrefix and indexKey must differ");
        }
        if (scanPageSize <= 0) {
            throw new IllegalArgumentException("scanPageSize must be positive");
        }
        keyPrefix = keyPrefix.clone();
        indexKey = indexKey.clone();
    }

    public static RedisStoreConfig create(String storeName) {
        Objects.requireNonNull(storeName, "storeName must not be null");
        return new RedisStoreConfig(
            (storeName + ":v:").getBytes(StandardCharsets.UTF_8),
            (storeName + ":k:").getBytes(StandardCharsets.UTF_8),
            DEFAULT_SCAN_PAGE_SIZE,
            BackoffConfig.create()
        );
    }

    @Override
    public byte[] keyPrefix() {
        return keyPrefix.clone();
    }

    @Override
    public byte[] indexKey() {
        return indexKey.clone();
    }

    public RedisStoreConfig withScanPageSize(int scanPageSize) {
        return new RedisStoreConfig(keyPrefix, indexKey, scanPageSize, backoff);
    }

    public RedisStoreConfig withBackoff(BackoffConfig backoff) {
        return new RedisStoreConfig(keyPrefix, indexKey, scanPageSize, backoff);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof RedisStoreConfig other
            && Arrays.equals(keyPrefix, other.keyPrefix)
            && Arrays.equals(indexKey, other.indexKey)
            && scanPageSize == other.scanPageSize
            && backoff.equals(other.backoff);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(keyPrefix), Arrays.hashCode(indexKey), scanPageSize, backoff);
    }

    @Override
    public String toString() {
        return "RedisStoreConfig[keyPrefix=" + new String(keyPrefix, StandardCharsets.UTF_8)
            + ", indexKey=" + new String(indexKey, StandardCharsets.UTF_8)
            + ", scanPageSize=" + scanPageSize
            + ", backoff=" + backoff + "]";
    }
}
