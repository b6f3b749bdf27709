package io.tabletalk.core.client;

import io.tabletalk.core.model.QueryFailure;
import java.util.Objects;

public class AnalysisException extends RuntimeException {
    private final QueryFailure failure;

    public AnalysisException(QueryFailure failure, String message) {
        this(failure, message, null);
    }

    public AnalysisException(QueryFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = Objects.requireNonNull(failure, "failure must not be null");
    }

    public QueryFailure failure() {
        return failure;
    }
}
