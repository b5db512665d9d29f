package io.mnemo.core.observability;

import static org.assertj.core.api.Assertions.assertThat;

import io.mnemo.core.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MetricsCollectorTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-06-01T00:00:00Z"));

    @Test
    void shouldSummarizeDurationsPerOperation() {
        MetricsCollector collector = new MetricsCollector(clock);
        for (int i = 1; i <= 100; i++) {
            collector.record("search_nodes", Duration.ofMillis(i), i % 4 == 0, i != 50);
        }

        OperationMetrics metrics = collector.snapshot().get("search_nodes");

        assertThat(metrics.count()).isEqualTo(100);
        assertThat(metrics.failures()).isEqualTo(1);
        assertThat(metrics.averageMillis()).isEqualTo(50.5);
        assertThat(metrics.p95Millis()).isEqualTo(95.0);
        assertThat(metrics.p99Millis()).isEqualTo(99.0);
        assertThat(metrics.cacheHitRate()).isEqualTo(25.0);
    }

    @Test
    void shouldKeepOnlyMostRecentSamples() {
        MetricsCollector collector = new MetricsCollector(clock, 3, Duration.ofHours(1));
        collector.record("read_graph", Duration.ofMillis(100), false, true);
        collector.record("read_graph", Duration.ofMillis(1), false, true);
        collector.record("read_graph", Duration.ofMillis(2), false, true);
        collector.record("read_graph", Duration.ofMillis(3), false, true);

        OperationMetrics metrics = collector.snapshot().get("read_graph");

        assertThat(metrics.count()).isEqualTo(3);
        assertThat(metrics.averageMillis()).isEqualTo(2.0);
    }

    @Test
    void shouldDropSamplesOutsideWindow() {
        MetricsCollector collector = new MetricsCollector(clock, 10, Duration.ofMinutes(10));
        collector.record("open_nodes", Duration.ofMillis(5), false, true);
        clock.advance(Duration.ofMinutes(11));
        collector.record("read_graph", Duration.ofMillis(7), false, true);

        Map<String, OperationMetrics> snapshot = collector.snapshot();

        assertThat(snapshot).containsOnlyKeys("read_graph");
    }

    @Test
    void shouldResetAllOperations() {
        MetricsCollector collector = new MetricsCollector(clock);
        collector.record("read_graph", Duration.ofMillis(7), false, true);

        collector.reset();

        assertThat(collector.snapshot()).isEmpty();
    }

    @Test
    void shouldPickNearestRankPercentile() {
        List<Double> sorted = List.of(1.0, 2.0, 3.0, 4.0);

        assertThat(MetricsCollector.percentile(sorted, 50)).isEqualTo(2.0);
        assertThat(MetricsCollector.percentile(sorted, 95)).isEqualTo(4.0);
        assertThat(MetricsCollector.percentile(sorted, 0)).isEqualTo(1.0);
        assertThat(MetricsCollector.percentile(List.of(), 99)).isZero();
    }
}
