package io.mnemo.core.partition;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class PartitionTest {

    private static final Instant NOW = Instant.parse("2026-06-01T00:00:00Z");

    @Test
    void shouldBucketByAge() {
        assertThat(forAge(Duration.ZERO)).isEqualTo(Partition.RECENT);
        assertThat(forAge(Duration.ofDays(30).minusMillis(1))).isEqualTo(Partition.RECENT);
        assertThat(forAge(Duration.ofDays(30))).isEqualTo(Partition.INTERMEDIATE);
        assertThat(forAge(Duration.ofDays(179))).isEqualTo(Partition.INTERMEDIATE);
        assertThat(forAge(Duration.ofDays(180))).isEqualTo(Partition.ARCHIVE);
        assertThat(forAge(Duration.ofDays(2_000))).isEqualTo(Partition.ARCHIVE);
    }

    @Test
    void shouldTreatFutureTimestampsAsRecent() {
        assertThat(Partition.forAge(NOW.plusSeconds(60), NOW, 30, 180)).isEqualTo(Partition.RECENT);
    }

    @Test
    void shouldResolvePartitionFromTableName() {
        assertThat(Partition.fromTable("entities_archive")).contains(Partition.ARCHIVE);
        assertThat(Partition.fromTable("relations")).isEmpty();
    }

    private Partition forAge(Duration age) {
        return Partition.forAge(NOW.minus(age), NOW, 30, 180);
    }
}
