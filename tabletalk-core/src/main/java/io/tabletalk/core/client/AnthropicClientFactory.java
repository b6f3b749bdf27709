package io.tabletalk.core.client;

import io.tabletalk.core.config.model.ProviderConfig;
import io.tabletalk.core.config.model.QueryConfig;
import io.tabletalk.core.provider.AnthropicProvider;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;

public final class AnthropicClientFactory implements AnalysisClientFactory {
    public static final String API_KEY_ENV = "ANTHROPIC_API_KEY";

    private final ProviderConfig provider;
    private final QueryConfig query;
    private final Function<String, String> env;

    public AnthropicClientFactory(ProviderConfig provider, QueryConfig query) {
        this(provider, query, System::getenv);
    }

    public AnthropicClientFactory(ProviderConfig provider, QueryConfig query, Function<String, String> env) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.query = Objects.requireNonNull(query, "query must not be null");
        this.env = Objects.requireNonNull(env, "env must not be null");
    }

    @Override
    public AnalysisClient create() {
        String apiKey = resolveApiKey();
        if (apiKey.isBlank()) {
            throw new ClientConstructionException(
                "missing API key for provider " + provider.name() + " (set provider.apiKey or " + API_KEY_ENV + ")"
            );
        }
        String apiBase = provider.apiBase() == null || provider.apiBase().isBlank()
            ? ProviderConfig.defaults().apiBase()
            : provider.apiBase();
        String model = provider.model() == null || provider.model().isBlank()
            ? ProviderConfig.defaults().model()
            : provider.model();
        int timeoutSeconds = provider.callTimeoutSeconds() > 0
            ? provider.callTimeoutSeconds()
            : ProviderConfig.defaults().callTimeoutSeconds();

        AnthropicProvider llm = new AnthropicProvider(
            provider.name() == null || provider.name().isBlank() ? "anthropic" : provider.name(),
            apiKey,
            apiBase,
            provider.maxTokens() > 0 ? provider.maxTokens() : ProviderConfig.defaults().maxTokens(),
            Duration.ofSeconds(timeoutSeconds)
        );
        return new LlmAnalysisClient(llm, model, new AnalysisPromptBuilder(query.maxPromptRows()));
    }

    private String resolveApiKey() {
        if (provider.configured()) {
            return provider.apiKey().trim();
        }
        String fromEnv = env.apply(API_KEY_ENV);
        return fromEnv == null ? "" : fromEnv.trim();
    }
}
