package io.mnemo.core.storage;

import static org.assertj.core.api.Assertions.assertThat;

import io.mnemo.core.MutableClock;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class ResultCacheTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T00:00:00Z"));

    @Test
    void shouldExpireEntriesAfterTheirTtl() {
        ResultCache cache = cache(10);
        cache.put("a", "value");

        clock.advance(Duration.ofSeconds(299));
        assertThat(cache.get("a", String.class)).contains("value");

        clock.advance(Duration.ofSeconds(2));
        assertThat(cache.get("a", String.class)).isEmpty();
    }

    @Test
    void shouldDropExpiredEntriesBeforeOldestOnesWhenFull() {
        ResultCache cache = new ResultCache(4, Duration.ofMinutes(5), Duration.ofMinutes(1), 0.5, clock);
        cache.put("a", 1, Duration.ofSeconds(10));
        cache.put("b", 2);
        cache.put("c", 3);
        cache.put("d", 4);
        clock.advance(Duration.ofSeconds(20));

        cache.put("e", 5);

        assertThat(cache.contains("a")).isFalse();
        assertThat(cache.contains("b")).isFalse();
        assertThat(cache.contains("c")).isTrue();
        assertThat(cache.contains("d")).isTrue();
        assertThat(cache.contains("e")).isTrue();
        assertThat(cache.size()).isEqualTo(3);
    }

    @Test
    void shouldNeverGrowBeyondCapacity() {
        ResultCache cache = cache(100);
        for (int i = 0; i < 1_000; i++) {
            cache.put("key-" + i, i);
            assertThat(cache.size()).isLessThanOrEqualTo(100);
        }
        assertThat(cache.get("key-999", Integer.class)).contains(999);
    }

    @Test
    void shouldInvalidateBySubstring() {
        ResultCache cache = cache(10);
        cache.put(ResultCache.key("SELECT * FROM relations", "x"), "r");
        cache.put(ResultCache.key("SELECT * FROM entities_recent", "x"), "e");

        int removed = cache.invalidate("entities_");

        assertThat(removed).isEqualTo(1);
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void shouldRejectPutsComputedBeforeFullInvalidation() {
        ResultCache cache = cache(10);
        long generation = cache.generation();

        cache.invalidateAll();

        assertThat(cache.putIfCurrent("k", "stale", generation)).isFalse();
        assertThat(cache.putIfCurrent("k", "fresh", cache.generation())).isTrue();
        assertThat(cache.get("k", String.class)).contains("fresh");
    }

    @Test
    void shouldSweepExpiredEntriesAtMostOncePerInterval() {
        ResultCache cache = cache(10);
        cache.put("short", "x", Duration.ofSeconds(10));

        clock.advance(Duration.ofSeconds(30));
        assertThat(cache.cleanupIfDue()).isZero();
        assertThat(cache.size()).isEqualTo(1);

        clock.advance(Duration.ofSeconds(31));
        assertThat(cache.cleanupIfDue()).isEqualTo(1);
        assertThat(cache.size()).isZero();
    }

    @Test
    void shouldDeriveKeysFromNormalizedTextAndParameters() {
        String key = ResultCache.key("SELECT *\n   FROM x WHERE a = ?", "alice");

        assertThat(key).isEqualTo(ResultCache.key("SELECT * FROM x WHERE a = ?", "alice"));
        assertThat(key).isNotEqualTo(ResultCache.key("SELECT * FROM x WHERE a = ?", "bob"));
        assertThat(key).startsWith("SELECT * FROM x WHERE a = ?#");
    }

    @Test
    void shouldCountHitsAndMisses() {
        ResultCache cache = cache(10);
        cache.put("k", "v");

        cache.get("k", String.class);
        cache.get("missing", String.class);
        cache.get("k", Integer.class);

        assertThat(cache.hits()).isEqualTo(1);
        assertThat(cache.misses()).isEqualTo(2);
    }

    private ResultCache cache(int capacity) {
        return new ResultCache(capacity, Duration.ofSeconds(300), Duration.ofSeconds(60), 0.9, clock);
    }
}
