package io.redisks.store;

import io.lettuce.core.KeyValue;
import io.lettuce.core.RedisClient;
import io.lettuce.core.ScanArgs;
import io.lettuce.core.ScanCursor;
import io.lettuce.core.ScriptOutputType;
import io.lettuce.core.ValueScanCursor;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.async.RedisAsyncCommands;
import io.lettuce.core.codec.ByteArrayCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

public final class LettuceRedisGateway implements RedisGateway {

    private static final Logger log = LoggerFactory.getLogger(LettuceRedisGateway.class);

    // futures complete on Lettuce I/O threads
    private final StatefulRedisConnection<byte[], byte[]> connection;
    private final RedisAsyncCommands<byte[], byte[]> redis;

    private LettuceRedisGateway(StatefulRedisConnection<byte[], byte[]> connection) {
        this.connection = connection;
        this.redis = connection.async();
    }

    public static LettuceRedisGateway connect(RedisClient client) {
        StatefulRedisConnection<byte[], byte[]> connection = client.connect(ByteArrayCodec.INSTANCE);
        return new LettuceRedisGateway(connection);
    }

    @Override
    public CompletableFuture<byte[]> get(byte[] key) {
        return redis.get(key).toCompletableFuture();
    }

    @Override
    public CompletableFuture<List<byte[]>> mget(List<byte[]> keys) {
        return redis.mget(keys.toArray(new byte[0][]))
            .toCompletableFuture()
            .thenApply(LettuceRedisGateway::values);
    }

    private static List<byte[]> values(List<KeyValue<byte[], byte[]>> entries) {
        List<byte[]> values = new ArrayList<>(entries.size());
        for (KeyValue<byte[], byte[]> entry : entries) {
            values.add(entry.hasValue() ? entry.getValue() : null);
        }
        return values;
    }

    @Override
    public CompletableFuture<Void> mset(Map<byte[], byte[]> entries) {
        return redis.mset(entries).toCompletableFuture().thenApply(status -> null);
    }

    @Override
    public CompletableFuture<Long> sadd(byte[] key, List<byte[]> members) {
        return redis.sadd(key, members.toArray(new byte[0][])).toCompletableFuture();
    }

    @Override
    public CompletableFuture<IndexPage> sscan(byte[] key, IndexPage previous, int count) {
        ScanArgs args = ScanArgs.Builder.limit(count);
        CompletableFuture<ValueScanCursor<byte[]>> page = previous == null
            ? redis.sscan(key, args).toCompletableFuture()
            : redis.sscan(key, new ScanCursor(previous.cursor(), false), args).toCompletableFuture();
        return page.thenApply(cursor -> new IndexPage(cursor.getCursor(), cursor.isFinished(), cursor.getValues()));
    }

    @Override
    public CompletableFuture<Long> scard(byte[] key) {
        return redis.scard(key).toCompletableFuture();
    }

    @Override
    public CompletableFuture<String> scriptLoad(String script) {
        return redis.scriptLoad(script).toCompletableFuture();
    }

    @Override
    public CompletableFuture<Void> evalStatus(String digest, byte[][] keys, byte[]... args) {
        return redis.<String>evalsha(digest, ScriptOutputType.STATUS, keys, args)
            .toCompletableFuture()
            .thenApply(status -> null);
    }

    @Override
    public CompletableFuture<byte[]> evalValue(String digest, byte[][] keys, byte[]... args) {
        return redis.<byte[]>evalsha(digest, ScriptOutputType.VALUE, keys, args).toCompletableFuture();
    }

    @Override
    public void flushCommands() {
        connection.flushCommands();
    }

    @Override
    public void close() {
        log.debug("Closing Redis connection");
        connection.close();
    }
}
