package io.redisks.store;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

public interface RedisGateway extends AutoCloseable {

    CompletableFuture<byte[]> get(byte[] key);

    CompletableFuture<List<byte[]>> mget(List<byte[]> keys);

    CompletableFuture<Void> mset(Map<byte[], byte[]> entries);

    CompletableFuture<Long> sadd(byte[] key, List<byte[]> members);

    // null previous starts a new scan
    CompletableFuture<IndexPage> sscan(byte[] key, IndexPage previous, int count);

    CompletableFuture<Long> scard(byte[] key);

    CompletableFuture<String> scriptLoad(String script);

    CompletableFuture<Void> evalStatus(String digest, byte[][] keys, byte[]... args);

    CompletableFuture<byte[]> evalValue(String digest, byte[][] keys, byte[]... args);

    void flushCommands();

    @Override
    void close();
}
