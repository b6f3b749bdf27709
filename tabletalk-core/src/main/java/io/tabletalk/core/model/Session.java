package io.tabletalk.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Session(
    String id,
    String datasetId,
    String title,
    Instant createdAt,
    Instant updatedAt
) {
    public Session {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(datasetId, "datasetId must not be null");
        title = title == null ? "" : title;
        createdAt = createdAt == null ? Instant.EPOCH : createdAt;
        updatedAt = updatedAt == null ? createdAt : updatedAt;
    }

    public Session touchedAt(Instant instant) {
        return new Session(id, datasetId, title, createdAt, instant);
    }
}
