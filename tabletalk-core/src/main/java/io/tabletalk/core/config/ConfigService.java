package io.tabletalk.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.tabletalk.core.api.GatewayServer;
import io.tabletalk.core.config.model.QueryConfig;
import io.tabletalk.core.config.model.TabletalkConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

public final class ConfigService {
    private static final Set<String> SESSION_STORES = Set.of("sqlite", "file");

    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public TabletalkConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return TabletalkConfig.defaults();
        }
        String raw = Files.readString(configPath);
        if (raw.isBlank()) {
            return TabletalkConfig.defaults();
        }

        JsonNode fileNode = mapper.readTree(raw);
        if (!fileNode.isObject()) {
            throw new IOException("Config " + configPath + " must be a JSON object");
        }
        JsonNode merged = overlay(mapper.valueToTree(TabletalkConfig.defaults()), fileNode);
        TabletalkConfig config = mapper.treeToValue(merged, TabletalkConfig.class);

        List<String> problems = problems(config);
        if (!problems.isEmpty()) {
            throw new IOException("Invalid config " + configPath + ": " + String.join("; ", problems));
        }
        return config;
    }

    public void save(Path configPath, TabletalkConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Files.createDirectories(configPath.toAbsolutePath().getParent());
        Files.writeString(configPath, toPrettyJson(config) + System.lineSeparator());
    }

    public OnboardResult onboard(Path configPath, boolean overwrite) throws IOException {
        OnboardResult.Action action;
        TabletalkConfig config;
        if (!Files.exists(configPath)) {
            action = OnboardResult.Action.CREATED;
            config = TabletalkConfig.defaults();
        } else if (overwrite) {
            action = OnboardResult.Action.OVERWRITTEN;
            config = TabletalkConfig.defaults();
        } else {
            action = OnboardResult.Action.REFRESHED;
            config = load(configPath);
        }
        save(configPath, config);

        WorkspaceLayout workspace = WorkspaceLayout.of(ConfigPaths.resolveWorkspace(config.workspace()));
        workspace.ensureDirectories();
        return new OnboardResult(configPath, workspace, action);
    }

    public String toPrettyJson(TabletalkConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    static List<String> problems(TabletalkConfig config) {
        List<String> problems = new ArrayList<>();
        String store = config.storage().sessionStore();
        if (store == null || !SESSION_STORES.contains(store.trim().toLowerCase(Locale.ROOT))) {
            problems.add("storage.sessionStore must be one of " + SESSION_STORES + " (was " + store + ")");
        }
        if (config.cache().maxDatasets() < 1) {
            problems.add("cache.maxDatasets must be at least 1");
        }
        if (config.query().maxContextEntries() < 0) {
            problems.add("query.maxContextEntries must not be negative");
        }
        if (config.query().retryBackoffMillis() < 0) {
            problems.add("query.retryBackoffMillis must not be negative");
        }
        problems.addAll(timeoutProblems(config.provider().callTimeoutSeconds(), config.query()));
        return problems;
    }

    // provider call < executor attempt <= query deadline < gateway idle timeout
    private static List<String> timeoutProblems(int callTimeoutSeconds, QueryConfig query) {
        List<String> problems = new ArrayList<>();
        long gatewaySeconds = GatewayServer.IDLE_TIMEOUT.toSeconds();
        if (query.invokeTimeoutSeconds() <= 0) {
            problems.add("query.invokeTimeoutSeconds must be positive");
        } else if (callTimeoutSeconds >= query.invokeTimeoutSeconds()) {
            problems.add("provider.callTimeoutSeconds (" + callTimeoutSeconds
                + ") must be below query.invokeTimeoutSeconds (" + query.invokeTimeoutSeconds() + ")");
        }
        if (query.deadlineSeconds() < query.invokeTimeoutSeconds()) {
            problems.add("query.deadlineSeconds (" + query.deadlineSeconds()
                + ") must be at least query.invokeTimeoutSeconds (" + query.invokeTimeoutSeconds() + ")");
        }
        if (query.deadlineSeconds() >= gatewaySeconds) {
            problems.add("query.deadlineSeconds (" + query.deadlineSeconds()
                + ") must be below the gateway idle timeout of " + gatewaySeconds + " s");
        }
        return problems;
    }

    private JsonNode overlay(JsonNode base, JsonNode override) {
        if (base == null || !base.isObject() || !override.isObject()) {
            return override;
        }
        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(field -> merged.set(field.getKey(), overlay(merged.get(field.getKey()), field.getValue())));
        return merged;
    }
}
