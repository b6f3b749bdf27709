package io.tabletalk.core.dataset;

public record DatasetCacheStats(
    long hits,
    long misses,
    long loads,
    long loadFailures,
    long evictions,
    long size,
    int capacity
) {
}
