package io.tabletalk.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.tabletalk.core.config.ConfigService;
import io.tabletalk.core.config.model.TabletalkConfig;
import io.tabletalk.core.engine.TabletalkEngine;
import io.tabletalk.core.model.Dataset;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class SessionCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldOpenSessionOnExistingDatasetOnly() throws Exception {
        try (TabletalkEngine engine = TabletalkEngine.open(TabletalkConfig.defaults(), tempDir.resolve("workspace"))) {
            Dataset dataset = engine.ingestor().ingest(
                "sales",
                "sales.json",
                "{\"columns\": [\"region\"], \"rows\": [[\"East\"]]}".getBytes(StandardCharsets.UTF_8)
            );
            CliContext context = new CliContext(engine, new ConfigService(), tempDir.resolve("config.json"));

            int unknown = new CommandLine(new SessionCommand(context)).execute("no-such-dataset");
            int opened = new CommandLine(new SessionCommand(context)).execute(dataset.id(), "--title", "Regional revenue");

            assertThat(unknown).isEqualTo(1);
            assertThat(opened).isEqualTo(0);
            assertThat(engine.sessionStore().list()).singleElement()
                .satisfies(session -> assertThat(session.title()).isEqualTo("Regional revenue"));
        }
    }

    @Test
    void shouldReportStatusAndDelegateGateway() throws Exception {
        try (TabletalkEngine engine = TabletalkEngine.open(TabletalkConfig.defaults(), tempDir.resolve("workspace"))) {
            AtomicInteger requestedPort = new AtomicInteger();
            AtomicReference<String> requestedHost = new AtomicReference<>();
            CliContext context = new CliContext(engine, new ConfigService(), tempDir.resolve("config.json"), (host, port) -> {
                requestedHost.set(host);
                requestedPort.set(port);
                return 0;
            });

            PrintStream originalOut = System.out;
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            try {
                System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
                assertThat(new CommandLine(new StatusCommand(context)).execute()).isEqualTo(0);
            } finally {
                System.setOut(originalOut);
            }

            assertThat(out.toString(StandardCharsets.UTF_8))
                .contains("Config exists: false")
                .contains("Session store: sqlite")
                .contains("Datasets: 0");
            assertThat(new CommandLine(new GatewayCommand(context)).execute("--port", "9191")).isEqualTo(0);
            assertThat(requestedPort).hasValue(9191);
            assertThat(requestedHost).hasValue("0.0.0.0");

            assertThat(new CommandLine(new GatewayCommand(context)).execute("--host", "127.0.0.1", "--port", "70000"))
                .isEqualTo(2);
            assertThat(requestedPort).hasValue(9191);
        }
    }
}
