package io.mnemo.core.graph;

import java.util.ArrayList;
import java.util.List;

final class Batches {

    private Batches() {
    }

    static <T> List<List<T>> of(List<T> items, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        List<List<T>> batches = new ArrayList<>();
        for (int start = 0; start < items.size(); start += batchSize) {
            batches.add(items.subList(start, Math.min(items.size(), start + batchSize)));
        }
        return batches;
    }
}
