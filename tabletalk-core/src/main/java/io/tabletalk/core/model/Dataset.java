package io.tabletalk.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Dataset(
    String id,
    String name,
    String storageKey,
    String fingerprint,
    DatasetStatus status,
    DatasetMetadata metadata,
    Instant uploadedAt
) {
    public Dataset {
        Objects.requireNonNull(id, "id must not be null");
        name = name == null ? "" : name;
        storageKey = storageKey == null ? "" : storageKey;
        fingerprint = fingerprint == null ? "" : fingerprint;
        status = status == null ? DatasetStatus.PENDING : status;
        metadata = metadata == null ? DatasetMetadata.empty() : metadata;
        uploadedAt = uploadedAt == null ? Instant.EPOCH : uploadedAt;
    }

    public boolean ready() {
        return status == DatasetStatus.READY;
    }

    public Dataset withStatus(DatasetStatus nextStatus, DatasetMetadata nextMetadata) {
        return new Dataset(id, name, storageKey, fingerprint, nextStatus, nextMetadata, uploadedAt);
    }
}
