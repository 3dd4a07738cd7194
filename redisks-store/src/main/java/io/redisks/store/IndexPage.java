package io.redisks.store;

import java.util.List;
import java.util.Objects;

public record IndexPage(String cursor, boolean finished, List<byte[]> members) {
    public IndexPage {
        Objects.requireNonNull(cursor, "cursor must not be null");
        Objects.requireNonNull(members, "members must not be null");
        members = List.copyOf(members);
    }
}
