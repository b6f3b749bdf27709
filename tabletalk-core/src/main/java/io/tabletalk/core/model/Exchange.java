package io.tabletalk.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.Objects;

/**
 * One persisted prompt/response pair. {@code errorMessage} and {@code failure} are set iff the
 * status is {@link ExchangeStatus#ERROR}; {@code visualization} is stored and replayed verbatim.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Exchange(
    String id,
    String sessionId,
    long sequence,
    String prompt,
    String responseText,
    JsonNode visualization,
    ExchangeStatus status,
    String errorMessage,
    QueryFailure failure,
    Instant createdAt
) {
    public Exchange {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        prompt = prompt == null ? "" : prompt;
        responseText = responseText == null ? "" : responseText;
        if (visualization != null && visualization.isNull()) {
            visualization = null;
        }
        if (status == ExchangeStatus.SUCCESS) {
            errorMessage = "";
            failure = null;
        } else {
            Objects.requireNonNull(failure, "failure must be set for error exchanges");
            errorMessage = errorMessage == null || errorMessage.isBlank() ? failure.userMessage() : errorMessage;
        }
        createdAt = createdAt == null ? Instant.EPOCH : createdAt;
    }

    public boolean succeeded() {
        return status == ExchangeStatus.SUCCESS;
    }
}
