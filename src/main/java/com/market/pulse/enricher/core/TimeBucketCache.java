package com.market.pulse.enricher.core;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory cache whose keys roll over every {@code ttl}.
 *
 * A value stored under {@code key} lives in the bucket {@code floor(now / ttl)} and
 * expires when the clock enters the next bucket. Expired entries are purged on every
 * put, so the map holds at most the keys written during the current bucket.
 * All methods are thread-safe (single monitor).
 */
public final class TimeBucketCache<V> {

    private static final class Entry<V> {
        final V v;
        final long expAtMillis;

        Entry(V v, long expAtMillis) {
            this.v = v;
            this.expAtMillis = expAtMillis;
        }
    }

    private final Map<String, Entry<V>> map = new HashMap<>();
    private final long ttlMillis;
    private final Clock clock;

    public TimeBucketCache(Duration ttl, Clock clock) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.ttlMillis = ttl.toMillis();
        this.clock = clock;
    }

    private long bucketOf(long nowMillis) {
        return Math.floorDiv(nowMillis, ttlMillis);
    }

    private static boolean isExpired(Entry<?> e, long now) {
        return e != null && now >= e.expAtMillis;
    }

    /**
     * Full key for {@code key} in the current bucket, e.g. {@code AAPL:company_news:5712345}.
     */
    public String bucketKey(String key) {
        return key + ":" + bucketOf(clock.millis());
    }

    public synchronized Optional<V> get(String key) {
        final long n = clock.millis();
        final String kk = key + ":" + bucketOf(n);
        final Entry<V> e = map.get(kk);
        if (e == null) return Optional.empty();
        if (isExpired(e, n)) {
            map.remove(kk);
            return Optional.empty();
        }
        return Optional.ofNullable(e.v);
    }

    public synchronized void put(String key, V value) {
        final long n = clock.millis();
        final long bucket = bucketOf(n);
        purgeExpired(n);
        map.put(key + ":" + bucket, new Entry<>(value, (bucket + 1) * ttlMillis));
    }

    /**
     * Number of live entries.
     */
    public synchronized int size() {
        purgeExpired(clock.millis());
        return map.size();
    }

    private void purgeExpired(long now) {
        map.values().removeIf(e -> isExpired(e, now));
    }
}
