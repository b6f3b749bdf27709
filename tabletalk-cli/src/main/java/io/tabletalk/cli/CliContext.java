package io.tabletalk.cli;

import io.tabletalk.core.config.ConfigService;
import io.tabletalk.core.engine.TabletalkEngine;
import java.nio.file.Path;

public record CliContext(
    TabletalkEngine engine,
    ConfigService configService,
    Path configPath,
    GatewayRunner gatewayRunner
) {
    public CliContext(TabletalkEngine engine, ConfigService configService, Path configPath) {
        this(engine, configService, configPath, (host, port) -> {
            throw new UnsupportedOperationException("gateway runner is not configured");
        });
    }
}
