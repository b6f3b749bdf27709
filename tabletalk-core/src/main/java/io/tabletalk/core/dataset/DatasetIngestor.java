package io.tabletalk.core.dataset;

import io.tabletalk.core.model.Dataset;
import io.tabletalk.core.model.DatasetMetadata;
import io.tabletalk.core.model.DatasetStatus;
import io.tabletalk.core.model.Table;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores uploaded tables, validates them and records their metadata. Ingestion failures are never
 * thrown to the caller once the dataset exists: they leave the dataset in {@link DatasetStatus#ERROR}
 * with the reason in its metadata.
 *
 * <p>Also serves as the {@link TableLoader} behind the {@link DatasetCache}.
 */
public final class DatasetIngestor implements TableLoader {
    private static final Logger LOG = LoggerFactory.getLogger(DatasetIngestor.class);

    private final DatasetRepository repository;
    private final DatasetStorage storage;
    private final JsonTableCodec codec;
    private final TableProfiler profiler;
    private final Clock clock;

    public DatasetIngestor(DatasetRepository repository, DatasetStorage storage, Clock clock) {
        this(repository, storage, new JsonTableCodec(), new TableProfiler(), clock);
    }

    public DatasetIngestor(
        DatasetRepository repository,
        DatasetStorage storage,
        JsonTableCodec codec,
        TableProfiler profiler,
        Clock clock
    ) {
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.storage = Objects.requireNonNull(storage, "storage must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.profiler = Objects.requireNonNull(profiler, "profiler must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public Dataset ingest(String name, Path source) throws IOException {
        Objects.requireNonNull(source, "source must not be null");
        String datasetName = name == null || name.isBlank() ? source.getFileName().toString() : name;
        return ingest(datasetName, source.getFileName().toString(), Files.readAllBytes(source));
    }

    public Dataset ingest(String name, String filename, byte[] bytes) throws IOException {
        String datasetName = name == null ? "" : name.trim();
        if (datasetName.isBlank()) {
            throw new IllegalArgumentException("Dataset name is required.");
        }
        if (datasetName.length() > 255) {
            throw new IllegalArgumentException("Dataset name must be less than 255 characters.");
        }

        String id = UUID.randomUUID().toString();
        String storageKey = storage.store(id + "-" + filename, bytes);
        Dataset dataset = new Dataset(
            id,
            datasetName,
            storageKey,
            DatasetFingerprint.of(bytes),
            DatasetStatus.PENDING,
            DatasetMetadata.empty(),
            clock.instant()
        );
        repository.save(dataset);

        Dataset processing = dataset.withStatus(DatasetStatus.PROCESSING, DatasetMetadata.empty());
        repository.save(processing);
        try {
            Table table = codec.decode(bytes);
            validate(table);
            Dataset ready = processing.withStatus(DatasetStatus.READY, profiler.profile(table, bytes.length));
            repository.save(ready);
            LOG.info("Ingested dataset {} ({} rows, {} columns)", id, table.rowCount(), table.columnCount());
            return ready;
        } catch (IOException | RuntimeException e) {
            LOG.warn("Dataset {} failed ingestion: {}", id, e.getMessage());
            Dataset failed = processing.withStatus(
                DatasetStatus.ERROR,
                DatasetMetadata.failed(e.getMessage(), bytes.length)
            );
            repository.save(failed);
            return failed;
        }
    }

    @Override
    public Table load(String datasetId, String fingerprint) throws IOException {
        Dataset dataset = repository.find(datasetId)
            .orElseThrow(() -> new IOException("Unknown dataset " + datasetId));
        if (!dataset.ready()) {
            throw new IOException("Dataset " + datasetId + " is " + dataset.status());
        }
        byte[] bytes = storage.read(dataset.storageKey());
        String actual = DatasetFingerprint.of(bytes);
        if (!actual.equals(fingerprint)) {
            throw new IOException("Stored bytes of dataset " + datasetId + " do not match fingerprint " + fingerprint);
        }
        return codec.decode(bytes);
    }

    private void validate(Table table) {
        if (table.columnCount() == 0) {
            throw new IllegalArgumentException("File has no columns");
        }
        if (table.rowCount() == 0) {
            throw new IllegalArgumentException("File has no data rows");
        }
    }
}
