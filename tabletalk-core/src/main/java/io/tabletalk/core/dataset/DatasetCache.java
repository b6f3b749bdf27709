package io.tabletalk.core.dataset;

import io.tabletalk.core.model.Table;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.LongAdder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded LRU cache of decoded tables keyed by dataset id and fingerprint.
 *
 * <p>Loads are single-flight: the first caller for a key runs the loader on its own thread while
 * later callers for the same key wait on the same future. A failed load is removed before the
 * waiters are released, so the key stays unpopulated and the next call loads again. The index lock
 * only guards map updates and is never held while a loader runs.
 *
 * <p>Only one fingerprint is kept per dataset. Asking for a new fingerprint drops the entry of the
 * previous one. Tables already handed out stay usable after eviction.
 */
public final class DatasetCache {
    private static final Logger LOG = LoggerFactory.getLogger(DatasetCache.class);
    public static final int DEFAULT_MAX_DATASETS = 32;

    private final int capacity;
    private final Object lock = new Object();
    private final Map<DatasetKey, CompletableFuture<Table>> entries;
    private final Map<String, String> currentFingerprints = new HashMap<>();
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder loads = new LongAdder();
    private final LongAdder loadFailures = new LongAdder();
    private final LongAdder evictions = new LongAdder();

    public DatasetCache() {
        this(DEFAULT_MAX_DATASETS);
    }

    public DatasetCache(int capacity) {
        this.capacity = Math.max(1, capacity);
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            private static final long serialVersionUID = 1L;

            @Override
            protected boolean removeEldestEntry(Map.Entry<DatasetKey, CompletableFuture<Table>> eldest) {
                if (size() <= DatasetCache.this.capacity) {
                    return false;
                }
                evictions.increment();
                LOG.debug("Evicted table for dataset {}", eldest.getKey().datasetId());
                return true;
            }
        };
    }

    public Table getOrLoad(String datasetId, String fingerprint, TableLoader loader) {
        Objects.requireNonNull(datasetId, "datasetId must not be null");
        Objects.requireNonNull(fingerprint, "fingerprint must not be null");
        Objects.requireNonNull(loader, "loader must not be null");

        DatasetKey key = new DatasetKey(datasetId, fingerprint);
        CompletableFuture<Table> pending = new CompletableFuture<>();
        CompletableFuture<Table> current;
        synchronized (lock) {
            retireStaleFingerprint(datasetId, fingerprint);
            current = entries.get(key);
            if (current == null) {
                entries.put(key, pending);
            }
        }
        if (current != null) {
            hits.increment();
            return await(key, current);
        }

        misses.increment();
        load(key, loader, pending);
        return await(key, pending);
    }

    public void invalidate(String datasetId) {
        synchronized (lock) {
            String fingerprint = currentFingerprints.remove(datasetId);
            if (fingerprint != null) {
                entries.remove(new DatasetKey(datasetId, fingerprint));
            }
        }
    }

    public long size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    public int capacity() {
        return capacity;
    }

    public DatasetCacheStats stats() {
        return new DatasetCacheStats(
            hits.sum(),
            misses.sum(),
            loads.sum(),
            loadFailures.sum(),
            evictions.sum(),
            size(),
            capacity
        );
    }

    private void load(DatasetKey key, TableLoader loader, CompletableFuture<Table> pending) {
        long started = System.nanoTime();
        try {
            Table table = loader.load(key.datasetId(), key.fingerprint());
            if (table == null) {
                throw new IllegalStateException("loader returned no table");
            }
            loads.increment();
            LOG.debug(
                "Loaded dataset {} ({} rows) in {} ms",
                key.datasetId(),
                table.rowCount(),
                (System.nanoTime() - started) / 1_000_000
            );
            pending.complete(table);
        } catch (Exception e) {
            loadFailures.increment();
            synchronized (lock) {
                entries.remove(key, pending);
            }
            LOG.warn("Failed to load dataset {}: {}", key.datasetId(), e.getMessage());
            pending.completeExceptionally(e);
        }
    }

    private Table await(DatasetKey key, CompletableFuture<Table> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new DatasetLoadException(key.datasetId(), "Failed to load dataset " + key.datasetId(), cause);
        } catch (CancellationException e) {
            throw new DatasetLoadException(key.datasetId(), "Load of dataset " + key.datasetId() + " was cancelled", e);
        }
    }

    // Caller holds the lock.
    private void retireStaleFingerprint(String datasetId, String fingerprint) {
        String previous = currentFingerprints.put(datasetId, fingerprint);
        if (previous != null && !previous.equals(fingerprint)) {
            entries.remove(new DatasetKey(datasetId, previous));
            LOG.debug("Dataset {} changed fingerprint, dropped cached table", datasetId);
        }
    }

    private record DatasetKey(String datasetId, String fingerprint) {
    }
}
