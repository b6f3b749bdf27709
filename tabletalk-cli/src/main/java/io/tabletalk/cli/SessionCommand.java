package io.tabletalk.cli;

import io.tabletalk.core.model.Dataset;
import io.tabletalk.core.model.Session;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "session", description = "Open a new analysis session on a dataset")
public final class SessionCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Dataset id")
    String datasetId;

    @Option(names = {"-t", "--title"}, description = "Session title")
    String title;

    public SessionCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            Optional<Dataset> dataset = context.engine().datasetRepository().find(datasetId);
            if (dataset.isEmpty()) {
                System.err.println("Session command failed: unknown dataset " + datasetId);
                return 1;
            }
            String sessionTitle = title == null || title.isBlank() ? "Analysis of " + dataset.get().name() : title;
            Session session = context.engine().sessionStore().create(datasetId, sessionTitle);
            System.out.println("Session: " + session.id() + " (" + session.title() + ")");
            return 0;
        } catch (Exception e) {
            System.err.println("Session command failed: " + e.getMessage());
            return 1;
        }
    }
}
