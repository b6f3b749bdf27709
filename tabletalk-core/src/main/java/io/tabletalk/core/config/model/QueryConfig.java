package io.tabletalk.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record QueryConfig(
    @JsonAlias({"max_context_entries"}) int maxContextEntries,
    @JsonAlias({"context_token_budget"}) int contextTokenBudget,
    @JsonAlias({"invoke_timeout_seconds"}) int invokeTimeoutSeconds,
    @JsonAlias({"retry_backoff_millis"}) long retryBackoffMillis,
    @JsonAlias({"max_prompt_rows"}) int maxPromptRows,
    @JsonAlias({"deadline_seconds"}) int deadlineSeconds
) {

    public static QueryConfig defaults() {
        return new QueryConfig(10, 0, 50, 1_000, 200, 110);
    }
}
