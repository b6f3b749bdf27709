package io.tabletalk.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderConfig(
    String name,
    @JsonAlias({"api_key"}) String apiKey,
    @JsonAlias({"api_base"}) String apiBase,
    String model,
    @JsonAlias({"max_tokens"}) int maxTokens,
    @JsonAlias({"call_timeout_seconds"}) int callTimeoutSeconds
) {

    public static ProviderConfig defaults() {
        return new ProviderConfig(
            "anthropic",
            "",
            "https://api.anthropic.com/v1",
            "claude-sonnet-4-5",
            4096,
            45
        );
    }

    public boolean configured() {
        return apiKey != null && !apiKey.isBlank();
    }
}
