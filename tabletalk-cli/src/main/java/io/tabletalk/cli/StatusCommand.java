package io.tabletalk.cli;

import io.tabletalk.core.client.AnthropicClientFactory;
import io.tabletalk.core.config.model.TabletalkConfig;
import io.tabletalk.core.dataset.DatasetCacheStats;
import io.tabletalk.core.engine.TabletalkEngine;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration and workspace status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            TabletalkEngine engine = context.engine();
            TabletalkConfig config = engine.config();
            boolean envKey = System.getenv(AnthropicClientFactory.API_KEY_ENV) != null
                && !System.getenv(AnthropicClientFactory.API_KEY_ENV).isBlank();
            DatasetCacheStats cache = engine.datasetCache().stats();

            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Workspace: " + engine.layout().root());
            System.out.println("Provider: " + config.provider().name());
            System.out.println("Model: " + config.provider().model());
            System.out.println("API key configured: " + (config.provider().configured() || envKey));
            System.out.println("Session store: " + config.storage().sessionStore());
            System.out.println("Datasets: " + engine.datasetRepository().list().size());
            System.out.println("Sessions: " + engine.sessionStore().list().size());
            System.out.println("Dataset cache capacity: " + cache.capacity());
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
