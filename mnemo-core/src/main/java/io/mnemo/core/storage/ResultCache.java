package io.mnemo.core.storage;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide cache of query results with per-entry time-to-live.
 *
 * <p>Entries are held in insertion order. When an insert would exceed the capacity, expired
 * entries are dropped first, then the oldest insertions until the size falls to the target
 * threshold. Expired entries are also swept lazily, at most once per cleanup interval.
 *
 * <p>Every {@link #invalidateAll()} bumps a generation counter; a reader that computed its
 * value under an older generation may not store it.
 */
public final class ResultCache {
    private static final Logger LOG = LoggerFactory.getLogger(ResultCache.class);

    private final int capacity;
    private final int targetSize;
    private final Duration defaultTtl;
    private final Duration cleanupInterval;
    private final Clock clock;
    private final Map<String, Entry> entries = new LinkedHashMap<>();
    private final AtomicLong generation = new AtomicLong();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private long lastCleanupMillis;

    public ResultCache(int capacity, Duration defaultTtl, Duration cleanupInterval, double targetRatio, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        if (targetRatio <= 0 || targetRatio > 1) {
            throw new IllegalArgumentException("targetRatio must be in (0, 1]");
        }
        this.capacity = capacity;
        this.targetSize = Math.min(capacity - 1, (int) Math.floor(capacity * targetRatio));
        this.defaultTtl = defaultTtl;
        this.cleanupInterval = cleanupInterval;
        this.clock = clock;
        this.lastCleanupMillis = clock.millis();
    }

    public static String key(String queryText, Object... params) {
        String normalized = queryText == null ? "" : queryText.trim().replaceAll("\\s+", " ");
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            for (Object param : params) {
                digest.update(String.valueOf(param).getBytes(StandardCharsets.UTF_8));
                digest.update((byte) 0x1f);
            }
            return normalized + "#" + HexFormat.of().formatHex(digest.digest(), 0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    public <T> Optional<T> get(String key, Class<T> type) {
        synchronized (this) {
            Entry entry = entries.get(key);
            if (entry != null && entry.expired(clock.millis())) {
                entries.remove(key);
                entry = null;
            }
            if (entry == null || !type.isInstance(entry.value())) {
                misses.incrementAndGet();
                return Optional.empty();
            }
            hits.incrementAndGet();
            return Optional.of(type.cast(entry.value()));
        }
    }

    public void put(String key, Object value) {
        put(key, value, defaultTtl);
    }

    public synchronized void put(String key, Object value, Duration ttl) {
        long now = clock.millis();
        entries.remove(key);
        if (entries.size() >= capacity) {
            int expired = removeExpired(now);
            int evicted = 0;
            Iterator<String> oldest = entries.keySet().iterator();
            while (entries.size() > targetSize && oldest.hasNext()) {
                oldest.next();
                oldest.remove();
                evicted++;
            }
            LOG.debug("Result cache at capacity: removed {} expired and {} oldest entries", expired, evicted);
        }
        entries.put(key, new Entry(value, now, ttl.toMillis()));
    }

    public synchronized boolean putIfCurrent(String key, Object value, long expectedGeneration) {
        if (generation.get() != expectedGeneration) {
            return false;
        }
        put(key, value);
        return true;
    }

    public long generation() {
        return generation.get();
    }

    public synchronized int cleanupIfDue() {
        long now = clock.millis();
        if (now - lastCleanupMillis < cleanupInterval.toMillis()) {
            return 0;
        }
        lastCleanupMillis = now;
        return removeExpired(now);
    }

    public synchronized int invalidate(String pattern) {
        if (pattern == null || pattern.isEmpty()) {
            return 0;
        }
        int before = entries.size();
        entries.keySet().removeIf(key -> key.contains(pattern));
        return before - entries.size();
    }

    public synchronized void invalidateAll() {
        generation.incrementAndGet();
        entries.clear();
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized boolean contains(String key) {
        return entries.containsKey(key);
    }

    public long hits() {
        return hits.get();
    }

    public long misses() {
        return misses.get();
    }

    private int removeExpired(long now) {
        int before = entries.size();
        entries.values().removeIf(entry -> entry.expired(now));
        return before - entries.size();
    }

    private record Entry(Object value, long insertedAtMillis, long ttlMillis) {
        boolean expired(long now) {
            return now - insertedAtMillis > ttlMillis;
        }
    }
}
