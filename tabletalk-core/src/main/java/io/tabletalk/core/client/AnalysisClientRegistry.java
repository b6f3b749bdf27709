package io.tabletalk.core.client;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the one {@link AnalysisClient} of the process.
 *
 * <p>The client is built by the first {@link #get()} call. Construction runs under a lock so racing
 * first callers produce a single client; afterwards {@code get()} is a volatile read. Calls made
 * through the client are not serialized. A failed construction publishes nothing and the next call
 * tries again.
 *
 * <p>{@link #reset()} builds a replacement and swaps it in. Callers that already hold the previous
 * client keep using it until their call completes.
 */
public final class AnalysisClientRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(AnalysisClientRegistry.class);

    private final AnalysisClientFactory factory;
    private final Object constructionLock = new Object();
    private final AtomicInteger constructions = new AtomicInteger();
    private volatile AnalysisClient client;

    public AnalysisClientRegistry(AnalysisClientFactory factory) {
        this.factory = Objects.requireNonNull(factory, "factory must not be null");
    }

    public AnalysisClient get() {
        AnalysisClient current = client;
        if (current != null) {
            return current;
        }
        synchronized (constructionLock) {
            if (client == null) {
                client = construct();
                LOG.info("Analysis client initialized");
            }
            return client;
        }
    }

    public AnalysisClient reset() {
        synchronized (constructionLock) {
            AnalysisClient fresh = construct();
            boolean replaced = client != null;
            client = fresh;
            LOG.info(replaced ? "Analysis client replaced" : "Analysis client initialized");
            return fresh;
        }
    }

    public boolean isInitialized() {
        return client != null;
    }

    public int constructionCount() {
        return constructions.get();
    }

    private AnalysisClient construct() {
        AnalysisClient created;
        try {
            created = factory.create();
        } catch (ClientConstructionException e) {
            LOG.warn("Analysis client construction failed: {}", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            LOG.warn("Analysis client construction failed", e);
            throw new ClientConstructionException("Failed to construct analysis client", e);
        }
        if (created == null) {
            throw new ClientConstructionException("Analysis client factory returned no client");
        }
        constructions.incrementAndGet();
        return created;
    }
}
