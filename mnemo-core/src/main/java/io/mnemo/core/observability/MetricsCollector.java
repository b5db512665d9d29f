package io.mnemo.core.observability;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

public final class MetricsCollector {
    public static final int DEFAULT_MAX_SAMPLES = 1_000;
    public static final Duration DEFAULT_WINDOW = Duration.ofHours(1);

    private final Clock clock;
    private final int maxSamples;
    private final Duration window;
    private final Map<String, Deque<Sample>> samples = new TreeMap<>();

    public MetricsCollector(Clock clock) {
        this(clock, DEFAULT_MAX_SAMPLES, DEFAULT_WINDOW);
    }

    public MetricsCollector(Clock clock, int maxSamples, Duration window) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (maxSamples <= 0) {
            throw new IllegalArgumentException("maxSamples must be > 0");
        }
        this.maxSamples = maxSamples;
        this.window = window;
    }

    public synchronized void record(String operation, Duration duration, boolean cacheHit, boolean success) {
        Deque<Sample> queue = samples.computeIfAbsent(operation, ignored -> new ArrayDeque<>());
        queue.addLast(new Sample(clock.millis(), duration.toNanos() / 1_000_000.0, cacheHit, success));
        while (queue.size() > maxSamples) {
            queue.removeFirst();
        }
    }

    public synchronized Map<String, OperationMetrics> snapshot() {
        long cutoff = clock.millis() - window.toMillis();
        Map<String, OperationMetrics> result = new LinkedHashMap<>();
        for (Map.Entry<String, Deque<Sample>> entry : samples.entrySet()) {
            Deque<Sample> queue = entry.getValue();
            while (!queue.isEmpty() && queue.peekFirst().recordedAtMillis() < cutoff) {
                queue.removeFirst();
            }
            if (!queue.isEmpty()) {
                result.put(entry.getKey(), summarize(entry.getKey(), queue));
            }
        }
        return result;
    }

    public synchronized void reset() {
        samples.clear();
    }

    private OperationMetrics summarize(String operation, Deque<Sample> queue) {
        List<Double> durations = new ArrayList<>(queue.size());
        int hits = 0;
        int failures = 0;
        double total = 0;
        for (Sample sample : queue) {
            durations.add(sample.durationMillis());
            total += sample.durationMillis();
            if (sample.cacheHit()) {
                hits++;
            }
            if (!sample.success()) {
                failures++;
            }
        }
        durations.sort(Double::compare);
        int count = durations.size();
        return new OperationMetrics(
            operation,
            count,
            failures,
            round2(total / count),
            round2(hits * 100.0 / count),
            round2(percentile(durations, 95)),
            round2(percentile(durations, 99))
        );
    }

    static double percentile(List<Double> sorted, int percentile) {
        if (sorted.isEmpty()) {
            return 0.0;
        }
        int safe = Math.max(0, Math.min(100, percentile));
        if (safe == 0) {
            return sorted.get(0);
        }
        int index = (int) Math.ceil((safe / 100.0) * sorted.size()) - 1;
        index = Math.max(0, Math.min(sorted.size() - 1, index));
        return sorted.get(index);
    }

    private double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    private record Sample(long recordedAtMillis, double durationMillis, boolean cacheHit, boolean success) {
    }
}
