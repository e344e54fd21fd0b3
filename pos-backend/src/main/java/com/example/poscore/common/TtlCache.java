package com.example.poscore.common;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Small read-through cache with a fixed time-to-live per entry. Owned by the
 * read-path component that creates it; never shared as a global.
 */
public class TtlCache<K, V> {

    private final Duration ttl;
    private final Clock clock;
    private final ConcurrentMap<K, Entry<V>> entries = new ConcurrentHashMap<>();

    public TtlCache(Duration ttl, Clock clock) {
        if (ttl == null || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be zero or positive");
        }
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * Returns the cached value for {@code key}, loading it when absent or
     * expired. Empty results are not cached.
     */
    public Optional<V> get(K key, Function<K, Optional<V>> loader) {
        Instant now = clock.instant();
        Entry<V> cached = entries.get(key);
        if (cached != null && now.isBefore(cached.expiresAt)) {
            return Optional.of(cached.value);
        }
        Optional<V> loaded = loader.apply(key);
        if (loaded.isPresent() && !ttl.isZero()) {
            entries.put(key, new Entry<>(loaded.get(), now.plus(ttl)));
        } else {
            entries.remove(key);
        }
        return loaded;
    }

    public void invalidate(K key) {
        entries.remove(key);
    }

    public void invalidateAll() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    private static final class Entry<V> {
        private final V value;
        private final Instant expiresAt;

        private Entry(V value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }
    }
}
