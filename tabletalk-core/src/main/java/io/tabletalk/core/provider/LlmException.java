package io.tabletalk.core.provider;

import io.tabletalk.core.model.QueryFailure;
import java.util.Objects;

public class LlmException extends RuntimeException {
    private final QueryFailure failure;

    public LlmException(QueryFailure failure, String message) {
        this(failure, message, null);
    }

    public LlmException(QueryFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = Objects.requireNonNull(failure, "failure must not be null");
    }

    public QueryFailure failure() {
        return failure;
    }
}
