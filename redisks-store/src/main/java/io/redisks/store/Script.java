package io.redisks.store;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

enum Script {
    PUT("put.lua"),
    PUT_IF_ABSENT("put_if_absent.lua"),
    DELETE("delete.lua");

    private final String resource;
    private final String body;

    Script(String resource) {
        this.resource = resource;
        this.body = load(resource);
    }

    String resource() {
        return resource;
    }

    String body() {
        return body;
    }

    private static String load(String resource) {
        try (InputStream in = Script.class.getResourceAsStream("/scripts/" + resource)) {
            if (in == null) {
                throw new IllegalStateException("Lua script not found on classpath: " + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load lua script '" + resource + "'", e);
        }
    }
}
