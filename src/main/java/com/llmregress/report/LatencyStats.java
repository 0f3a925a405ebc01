package com.llmregress.report;

import java.util.Arrays;
import java.util.Collection;

public record LatencyStats(int count, long minMs, double meanMs, long p50Ms, long p90Ms, long p95Ms, long p99Ms, long maxMs) {
    public static final LatencyStats EMPTY = new LatencyStats(0, 0, 0.0, 0, 0, 0, 0, 0);

    public static LatencyStats of(Collection<Long> samplesMs) {
        if (samplesMs.isEmpty()) {
            return EMPTY;
        }
        long[] sorted = samplesMs.stream().mapToLong(Long::longValue).toArray();
        Arrays.sort(sorted);
        double mean = Arrays.stream(sorted).average().orElse(0.0);
        return new LatencyStats(
                sorted.length,
                sorted[0],
                mean,
                nearestRank(sorted, 50),
                nearestRank(sorted, 90),
                nearestRank(sorted, 95),
                nearestRank(sorted, 99),
                sorted[sorted.length - 1]);
    }

    static long nearestRank(long[] sorted, int percentile) {
        int rank = (int) Math.ceil(percentile / 100.0 * sorted.length);
        return sorted[Math.max(0, Math.min(sorted.length, rank) - 1)];
    }

    public boolean isEmpty() {
        return count == 0;
    }
}
