package io.tabletalk.core.engine;

import io.tabletalk.core.client.AnalysisClientRegistry;
import io.tabletalk.core.client.AnthropicClientFactory;
import io.tabletalk.core.config.ConfigPaths;
import io.tabletalk.core.config.WorkspaceLayout;
import io.tabletalk.core.config.model.TabletalkConfig;
import io.tabletalk.core.dataset.DatasetCache;
import io.tabletalk.core.dataset.DatasetIngestor;
import io.tabletalk.core.dataset.DatasetRepository;
import io.tabletalk.core.dataset.FileDatasetRepository;
import io.tabletalk.core.dataset.LocalDatasetStorage;
import io.tabletalk.core.model.Dataset;
import io.tabletalk.core.model.Session;
import io.tabletalk.core.observability.FileAuditStore;
import io.tabletalk.core.observability.ObservabilityService;
import io.tabletalk.core.query.QueryExecutor;
import io.tabletalk.core.query.QuerySettings;
import io.tabletalk.core.session.FileSessionStore;
import io.tabletalk.core.session.SessionStore;
import io.tabletalk.core.session.SqliteSessionStore;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class TabletalkEngine implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(TabletalkEngine.class);

    private final TabletalkConfig config;
    private final WorkspaceLayout layout;
    private final DatasetRepository datasetRepository;
    private final DatasetIngestor ingestor;
    private final SessionStore sessionStore;
    private final DatasetCache datasetCache;
    private final AnalysisClientRegistry clientRegistry;
    private final ObservabilityService observability;
    private final QueryExecutor queryExecutor;

    private TabletalkEngine(TabletalkConfig config, WorkspaceLayout layout, Clock clock) throws IOException {
        this.config = config;
        this.layout = layout;
        this.datasetRepository = new FileDatasetRepository(layout.datasetIndex());
        this.ingestor = new DatasetIngestor(datasetRepository, new LocalDatasetStorage(layout.datasetFiles()), clock);
        this.sessionStore = openSessionStore(config, layout, clock);
        this.datasetCache = new DatasetCache(config.cache().maxDatasets());
        this.clientRegistry = new AnalysisClientRegistry(new AnthropicClientFactory(config.provider(), config.query()));
        this.observability = new ObservabilityService(new FileAuditStore(layout.auditLog()), clock);
        this.queryExecutor = new QueryExecutor(
            sessionStore,
            datasetRepository,
            datasetCache,
            ingestor,
            clientRegistry,
            QuerySettings.from(config.query()),
            null,
            observability
        );
    }

    public static TabletalkEngine open(TabletalkConfig config) throws IOException {
        Objects.requireNonNull(config, "config must not be null");
        return open(config, ConfigPaths.resolveWorkspace(config.workspace()));
    }

    public static TabletalkEngine open(TabletalkConfig config, Path workspace) throws IOException {
        Objects.requireNonNull(config, "config must not be null");
        WorkspaceLayout layout = WorkspaceLayout.of(workspace.toAbsolutePath().normalize());
        layout.ensureDirectories();
        LOG.debug("Opening workspace {}", layout.root());
        return new TabletalkEngine(config, layout, Clock.systemUTC());
    }

    public IngestResult ingest(String name, Path source) throws IOException {
        Dataset dataset = ingestor.ingest(name, source);
        if (!dataset.ready()) {
            return new IngestResult(dataset, null);
        }
        Session session = sessionStore.create(dataset.id(), "Analysis of " + dataset.name());
        return new IngestResult(dataset, session);
    }

    public TabletalkConfig config() {
        return config;
    }

    public WorkspaceLayout layout() {
        return layout;
    }

    public DatasetRepository datasetRepository() {
        return datasetRepository;
    }

    public DatasetIngestor ingestor() {
        return ingestor;
    }

    public SessionStore sessionStore() {
        return sessionStore;
    }

    public DatasetCache datasetCache() {
        return datasetCache;
    }

    public AnalysisClientRegistry clientRegistry() {
        return clientRegistry;
    }

    public ObservabilityService observability() {
        return observability;
    }

    public QueryExecutor queryExecutor() {
        return queryExecutor;
    }

    @Override
    public void close() {
        queryExecutor.close();
    }

    private static SessionStore openSessionStore(TabletalkConfig config, WorkspaceLayout layout, Clock clock)
        throws IOException {
        String backend = config.storage().sessionStore() == null
            ? "sqlite"
            : config.storage().sessionStore().trim().toLowerCase(Locale.ROOT);
        if ("file".equals(backend)) {
            return new FileSessionStore(layout.sessionsDirectory(), clock);
        }
        if (!"sqlite".equals(backend)) {
            throw new IllegalArgumentException("Unknown session store: " + config.storage().sessionStore());
        }
        return new SqliteSessionStore(layout.sessionsDatabase(), clock);
    }

    public record IngestResult(Dataset dataset, Session session) {
    }
}
