package io.tabletalk.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.tabletalk.core.config.model.TabletalkConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadDefaultsWhenConfigMissing() throws Exception {
        ConfigService service = new ConfigService();

        TabletalkConfig config = service.load(tempDir.resolve("config.json"));

        assertThat(config.provider().model()).isEqualTo("claude-sonnet-4-5");
        assertThat(config.provider().configured()).isFalse();
        assertThat(config.query().maxContextEntries()).isEqualTo(10);
        assertThat(config.cache().maxDatasets()).isEqualTo(32);
        assertThat(config.storage().sessionStore()).isEqualTo("sqlite");
    }

    @Test
    void shouldMergeDefaultsWithExistingValues() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "provider": {
                "apiKey": "sk-test",
                "model": "claude-opus-4-1"
              },
              "query": {
                "invokeTimeoutSeconds": 55
              },
              "storage": {
                "sessionStore": "file"
              }
            }
            """);

        TabletalkConfig config = service.load(configPath);

        assertThat(config.provider().apiKey()).isEqualTo("sk-test");
        assertThat(config.provider().model()).isEqualTo("claude-opus-4-1");
        assertThat(config.provider().apiBase()).isEqualTo("https://api.anthropic.com/v1");
        assertThat(config.query().invokeTimeoutSeconds()).isEqualTo(55);
        assertThat(config.query().deadlineSeconds()).isEqualTo(110);
        assertThat(config.query().retryBackoffMillis()).isEqualTo(1_000);
        assertThat(config.storage().sessionStore()).isEqualTo("file");
    }

    @Test
    void onboardShouldCreateConfigAndWorkspaceDirectories() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve(".tabletalk/config.json");

        OnboardResult first = service.onboard(configPath, false);
        OnboardResult second = service.onboard(configPath, true);

        assertThat(first.action()).isEqualTo(OnboardResult.Action.CREATED);
        assertThat(second.action()).isEqualTo(OnboardResult.Action.OVERWRITTEN);
        assertThat(Files.exists(configPath)).isTrue();
        WorkspaceLayout layout = first.workspace();
        assertThat(Files.isDirectory(layout.datasetFiles())).isTrue();
        assertThat(Files.isDirectory(layout.sessionsDirectory())).isTrue();
    }

    @Test
    void onboardShouldKeepExistingValuesWhenRefreshing() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {"workspace": "%s", "cache": {"maxDatasets": 4}}
            """.formatted(tempDir.resolve("ws").toString().replace("\\", "/")));

        OnboardResult result = service.onboard(configPath, false);

        assertThat(result.action()).isEqualTo(OnboardResult.Action.REFRESHED);
        assertThat(result.workspace().root()).isEqualTo(tempDir.resolve("ws"));
        TabletalkConfig reloaded = service.load(configPath);
        assertThat(reloaded.cache().maxDatasets()).isEqualTo(4);
        assertThat(Files.readString(configPath)).contains("\"sessionStore\" : \"sqlite\"");
    }

    @Test
    void shouldRejectConfigWithUnusableValues() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {"storage": {"session_store": "postgres"}, "cache": {"max_datasets": 0}}
            """);

        assertThatThrownBy(() -> service.load(configPath))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("storage.sessionStore must be one of")
            .hasMessageContaining("cache.maxDatasets must be at least 1");
    }

    @Test
    void shouldRejectTimeoutsThatDoNotNest() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "provider": {"callTimeoutSeconds": 60},
              "query": {"invokeTimeoutSeconds": 50, "deadlineSeconds": 130}
            }
            """);

        assertThatThrownBy(() -> service.load(configPath))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("provider.callTimeoutSeconds (60) must be below query.invokeTimeoutSeconds (50)")
            .hasMessageContaining("query.deadlineSeconds (130) must be below the gateway idle timeout of 120 s");
    }

    @Test
    void shouldRejectDeadlineShorterThanOneAttempt() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {"query": {"invoke_timeout_seconds": 50, "deadline_seconds": 40}}
            """);

        assertThatThrownBy(() -> service.load(configPath))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("query.deadlineSeconds (40) must be at least query.invokeTimeoutSeconds (50)");
    }

    @Test
    void shouldRejectConfigThatIsNotAnObject() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, "[1, 2]");

        assertThatThrownBy(() -> service.load(configPath))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("must be a JSON object");
    }

    @Test
    void shouldResolveConfigOverrideAndHomeShortcuts() {
        Path home = Path.of(System.getProperty("user.home"));

        assertThat(ConfigPaths.configPath("~/alt/config.json")).isEqualTo(home.resolve("alt/config.json"));
        assertThat(ConfigPaths.configPath("  ")).isEqualTo(home.resolve(".tabletalk/config.json"));
        assertThat(ConfigPaths.resolveWorkspace("~")).isEqualTo(home);
        assertThat(ConfigPaths.resolveWorkspace(null)).isEqualTo(home.resolve(".tabletalk/workspace"));
    }
}
