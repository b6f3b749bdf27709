package io.tabletalk.app;

import io.tabletalk.cli.AskCommand;
import io.tabletalk.cli.CliContext;
import io.tabletalk.cli.GatewayCommand;
import io.tabletalk.cli.HistoryCommand;
import io.tabletalk.cli.IngestCommand;
import io.tabletalk.cli.OnboardCommand;
import io.tabletalk.cli.SessionCommand;
import io.tabletalk.cli.StatusCommand;
import io.tabletalk.cli.TabletalkCliCommand;
import io.tabletalk.core.api.GatewayServer;
import io.tabletalk.core.config.ConfigPaths;
import io.tabletalk.core.config.ConfigService;
import io.tabletalk.core.config.model.TabletalkConfig;
import io.tabletalk.core.engine.TabletalkEngine;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class TabletalkApplication {
    private static final Logger LOG = LoggerFactory.getLogger(TabletalkApplication.class);

    private TabletalkApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        TabletalkConfig config = loadConfig(configService, configPath);

        int exitCode;
        try (TabletalkEngine engine = TabletalkEngine.open(config)) {
            CliContext context = new CliContext(
                engine,
                configService,
                configPath,
                (host, port) -> runGateway(engine, host, port)
            );

            CommandLine commandLine = new CommandLine(new TabletalkCliCommand());
            commandLine.addSubcommand("onboard", new OnboardCommand(context));
            commandLine.addSubcommand("status", new StatusCommand(context));
            commandLine.addSubcommand("ingest", new IngestCommand(context));
            commandLine.addSubcommand("session", new SessionCommand(context));
            commandLine.addSubcommand("ask", new AskCommand(context));
            commandLine.addSubcommand("history", new HistoryCommand(context));
            commandLine.addSubcommand("gateway", new GatewayCommand(context));
            exitCode = commandLine.execute(args);
        } catch (Exception e) {
            LOG.error("Failed to open workspace {}", config.workspace(), e);
            System.err.println("Failed to open workspace: " + e.getMessage());
            exitCode = 1;
        }
        System.exit(exitCode);
    }

    private static TabletalkConfig loadConfig(ConfigService configService, Path configPath) {
        try {
            return configService.load(configPath);
        } catch (Exception e) {
            LOG.warn("Could not read config {}, using defaults: {}", configPath, e.getMessage());
            return TabletalkConfig.defaults();
        }
    }

    private static int runGateway(TabletalkEngine engine, String host, int port) throws Exception {
        CountDownLatch shutdown = new CountDownLatch(1);
        try (GatewayServer server = new GatewayServer(
            port,
            host,
            engine.queryExecutor(),
            engine.datasetCache(),
            engine.observability()
        )) {
            Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown));
            server.start();
            String shownHost = "0.0.0.0".equals(host) ? "127.0.0.1" : host;
            System.out.println("Gateway started on http://" + shownHost + ":" + server.port());
            System.out.println("Endpoints: GET /healthz, GET /sessions/{id}/exchanges, POST /sessions/{id}/queries, GET /stats");
            shutdown.await();
        }
        return 0;
    }
}
