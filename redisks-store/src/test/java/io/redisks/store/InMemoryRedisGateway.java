package io.redisks.store;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

final class InMemoryRedisGateway implements RedisGateway {

    private final Map<ByteBuffer, byte[]> strings = new HashMap<>();
    private final Map<ByteBuffer, Set<ByteBuffer>> sets = new HashMap<>();
    private final Map<String, Script> scripts = new HashMap<>();
    private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> failures = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile boolean failEverything;

    void failNext(String command, int times) {
        failures.computeIfAbsent(command, c -> new AtomicInteger()).set(times);
    }

    void failEverything(boolean fail) {
        this.failEverything = fail;
    }

    int calls(String command) {
        AtomicInteger count = calls.get(command);
        return count == null ? 0 : count.get();
    }

    int totalCalls() {
        return calls.values().stream().mapToInt(AtomicInteger::get).sum();
    }

    boolean isClosed() {
        return closed.get();
    }

    synchronized void putRaw(byte[] key, byte[] value) {
        strings.put(ByteBuffer.wrap(key.clone()), value.clone());
    }

    synchronized void addToSet(byte[] key, byte[] member) {
        sets.computeIfAbsent(ByteBuffer.wrap(key.clone()), k -> new LinkedHashSet<>()).add(ByteBuffer.wrap(member.clone()));
    }

    synchronized byte[] rawValue(byte[] key) {
        return strings.get(ByteBuffer.wrap(key));
    }

    synchronized int setSize(byte[] key) {
        Set<ByteBuffer> members = sets.get(ByteBuffer.wrap(key));
        return members == null ? 0 : members.size();
    }

    private <T> CompletableFuture<T> call(String command, Supplier<T> action) {
        calls.computeIfAbsent(command, c -> new AtomicInteger()).incrementAndGet();
        AtomicInteger remaining = failures.get(command);
        if (failEverything || (remaining != null && remaining.getAndUpdate(n -> Math.max(0, n - 1)) > 0)) {
            return CompletableFuture.failedFuture(new TimeoutException(command + " timed out"));
        }
        synchronized (this) {
            return CompletableFuture.completedFuture(action.get());
        }
    }

    @Override
    public CompletableFuture<byte[]> get(byte[] key) {
        return call("GET", () -> strings.get(ByteBuffer.wrap(key)));
    }

    @Override
    public CompletableFuture<List<byte[]>> mget(List<byte[]> keys) {
        return call("MGET", () -> {
            List<byte[]> values = new ArrayList<>(keys.size());
            for (byte[] key : keys) {
                values.add(strings.get(ByteBuffer.wrap(key)));
            }
            return values;
        });
    }

    @Override
    public CompletableFuture<Void> mset(Map<byte[], byte[]> entries) {
        return call("MSET", () -> {
            entries.forEach((key, value) -> strings.put(ByteBuffer.wrap(key.clone()), value.clone()));
            return null;
        });
    }

    @Override
    public CompletableFuture<Long> sadd(byte[] key, List<byte[]> members) {
        return call("SADD", () -> {
            Set<ByteBuffer> set = sets.computeIfAbsent(ByteBuffer.wrap(key.clone()), k -> new LinkedHashSet<>());
            long added = 0;
            for (byte[] member : members) {
                if (set.add(ByteBuffer.wrap(member.clone()))) {
                    added++;
                }
            }
            return added;
        });
    }

    @Override
    public CompletableFuture<IndexPage> sscan(byte[] key, IndexPage previous, int count) {
        return call("SSCAN", () -> {
            List<ByteBuffer> members = new ArrayList<>(sets.getOrDefault(ByteBuffer.wrap(key), Set.of()));
            int from = previous == null ? 0 : Integer.parseInt(previous.cursor());
            int to = Math.min(members.size(), from + count);
            List<byte[]> page = new ArrayList<>();
            for (int i = from; i < to; i++) {
                page.add(bytes(members.get(i)));
            }
            boolean finished = to >= members.size();
            return new IndexPage(finished ? "0" : Integer.toString(to), finished, page);
        });
    }

    @Override
    public CompletableFuture<Long> scard(byte[] key) {
        return call("SCARD", () -> (long) sets.getOrDefault(ByteBuffer.wrap(key), Set.of()).size());
    }

    @Override
    public CompletableFuture<String> scriptLoad(String body) {
        return call("SCRIPT LOAD", () -> {
            for (Script script : Script.values()) {
                if (script.body().equals(body)) {
                    String digest = sha1(body);
                    scripts.put(digest, script);
                    return digest;
                }
            }
            throw new IllegalArgumentException("Unknown script");
        });
    }

    @Override
    public CompletableFuture<Void> evalStatus(String digest, byte[][] keys, byte[]... args) {
        return evalValue(digest, keys, args).thenApply(ignored -> null);
    }

    @Override
    public CompletableFuture<byte[]> evalValue(String digest, byte[][] keys, byte[]... args) {
        return call("EVALSHA", () -> {
            Script script = scripts.get(digest);
            if (script == null) {
                throw new IllegalStateException("NOSCRIPT No matching script");
            }
            ByteBuffer valueKey = ByteBuffer.wrap(keys[0].clone());
            ByteBuffer indexKey = ByteBuffer.wrap(keys[1].clone());
            switch (script) {
                case PUT:
                    strings.put(valueKey, args[0].clone());
                    sets.computeIfAbsent(indexKey, k -> new LinkedHashSet<>()).add(ByteBuffer.wrap(args[1].clone()));
                    return null;
                case PUT_IF_ABSENT: {
                    byte[] existing = strings.get(valueKey);
                    if (existing != null) {
                        return existing;
                    }
                    strings.put(valueKey, args[0].clone());
                    sets.computeIfAbsent(indexKey, k -> new LinkedHashSet<>()).add(ByteBuffer.wrap(args[1].clone()));
                    return null;
                }
                case DELETE: {
                    byte[] existing = strings.remove(valueKey);
                    Set<ByteBuffer> index = sets.get(indexKey);
                    if (index != null) {
                        index.remove(ByteBuffer.wrap(args[0]));
                    }
                    return existing;
                }
                default:
                    throw new IllegalStateException("Unexpected script " + script);
            }
        });
    }

    @Override
    public void flushCommands() {
        calls.computeIfAbsent("FLUSH", c -> new AtomicInteger()).incrementAndGet();
    }

    @Override
    public void close() {
        closed.set(true);
    }

    private static byte[] bytes(ByteBuffer buffer) {
        ByteBuffer duplicate = buffer.duplicate();
        byte[] bytes = new byte[duplicate.remaining()];
        duplicate.get(bytes);
        return bytes;
    }

    private static String sha1(String body) {
        try {
            MessageDigest sha1 = MessageDigest.getInstance("SHA-1");
            return HexFormat.of().formatHex(sha1.digest(body.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }
}
