package io.tabletalk.cli;

import io.tabletalk.core.client.AnthropicClientFactory;
import io.tabletalk.core.config.OnboardResult;
import io.tabletalk.core.config.WorkspaceLayout;
import io.tabletalk.core.config.model.TabletalkConfig;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "onboard", description = "Write the config file and create the workspace directories")
public final class OnboardCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--overwrite", description = "Replace an existing config with the defaults")
    boolean overwrite;

    public OnboardCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        OnboardResult result;
        TabletalkConfig config;
        try {
            result = context.configService().onboard(context.configPath(), overwrite);
            config = context.configService().load(result.configPath());
        } catch (Exception e) {
            System.err.println("Onboard failed: " + e.getMessage());
            return 1;
        }

        String verb = switch (result.action()) {
            case CREATED -> "Created";
            case OVERWRITTEN -> "Reset to defaults";
            case REFRESHED -> "Refreshed";
        };
        System.out.println(verb + " config: " + result.configPath());

        WorkspaceLayout workspace = result.workspace();
        System.out.println("Workspace: " + workspace.root());
        System.out.println("  datasets: " + workspace.datasetFiles());
        System.out.println("  sessions: " + ("file".equalsIgnoreCase(config.storage().sessionStore())
            ? workspace.sessionsDirectory()
            : workspace.sessionsDatabase()));

        if (!config.provider().configured() && System.getenv(AnthropicClientFactory.API_KEY_ENV) == null) {
            System.out.println("No API key yet: set provider.apiKey in the config or export "
                + AnthropicClientFactory.API_KEY_ENV);
        }
        System.out.println("Next: tabletalk ingest <file.json>");
        return 0;
    }
}
