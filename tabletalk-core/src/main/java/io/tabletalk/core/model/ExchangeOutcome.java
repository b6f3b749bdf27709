package io.tabletalk.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.Objects;

public record ExchangeOutcome(
    String prompt,
    String responseText,
    JsonNode visualization,
    ExchangeStatus status,
    QueryFailure failure
) {
    public ExchangeOutcome {
        Objects.requireNonNull(status, "status must not be null");
        prompt = prompt == null ? "" : prompt;
        responseText = responseText == null ? "" : responseText;
        if (status == ExchangeStatus.ERROR) {
            Objects.requireNonNull(failure, "failure must be set for error outcomes");
        }
    }

    public static ExchangeOutcome success(String prompt, String responseText, JsonNode visualization) {
        return new ExchangeOutcome(prompt, responseText, visualization, ExchangeStatus.SUCCESS, null);
    }

    public static ExchangeOutcome failure(String prompt, QueryFailure failure) {
        return new ExchangeOutcome(prompt, "", null, ExchangeStatus.ERROR, failure);
    }

    public String errorMessage() {
        return failure == null ? "" : failure.userMessage();
    }

    public Exchange toExchange(String id, String sessionId, long sequence, Instant createdAt) {
        return new Exchange(
            id,
            sessionId,
            sequence,
            prompt,
            responseText,
            visualization,
            status,
            errorMessage(),
            failure,
            createdAt
        );
    }
}
