package io.tabletalk.cli;

import io.tabletalk.core.engine.TabletalkEngine.IngestResult;
import io.tabletalk.core.model.Dataset;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "ingest", description = "Ingest a JSON table file and open a session on it")
public final class IngestCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Table file to ingest")
    Path file;

    @Option(names = {"-n", "--name"}, description = "Dataset name (defaults to the file name)")
    String name;

    public IngestCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            IngestResult result = context.engine().ingest(name, file);
            Dataset dataset = result.dataset();
            if (!dataset.ready()) {
                System.err.println("Ingest failed: " + dataset.metadata().error());
                return 1;
            }
            System.out.println("Dataset: " + dataset.id());
            System.out.println("Rows: " + dataset.metadata().rowCount() + ", columns: " + dataset.metadata().columnCount());
            dataset.metadata().parseWarnings().forEach(warning -> System.out.println("Warning: " + warning));
            System.out.println("Session: " + result.session().id() + " (" + result.session().title() + ")");
            return 0;
        } catch (Exception e) {
            System.err.println("Ingest command failed: " + e.getMessage());
            return 1;
        }
    }
}
