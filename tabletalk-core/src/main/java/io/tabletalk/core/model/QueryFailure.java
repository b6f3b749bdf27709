package io.tabletalk.core.model;

/**
 * Failure categories of a query. Each category carries the message shown to the user; upstream
 * error text never reaches an exchange.
 */
public enum QueryFailure {
    DATA_UNAVAILABLE(false, "The dataset for this session is not available right now. "
        + "Check that it finished processing and try again."),
    RATE_LIMITED(true, "The analysis service is busy. Please wait a moment and try again."),
    TIMEOUT(true, "The analysis took too long to complete. Try a simpler question."),
    CONTEXT_TOO_LARGE(false, "The conversation is too long for the analysis service. "
        + "Start a new session or ask a shorter question."),
    MALFORMED_OUTPUT(false, "The analysis service returned a result that could not be read. "
        + "Try rephrasing your question."),
    UPSTREAM_UNAVAILABLE(true, "The analysis service could not be reached. Please try again later.");

    private final boolean retryable;
    private final String userMessage;

    QueryFailure(boolean retryable, String userMessage) {
        this.retryable = retryable;
        this.userMessage = userMessage;
    }

    public boolean retryable() {
        return retryable;
    }

    public String userMessage() {
        return userMessage;
    }
}
