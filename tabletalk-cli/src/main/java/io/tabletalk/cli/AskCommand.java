package io.tabletalk.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.tabletalk.core.model.Exchange;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "ask", description = "Ask a question about the dataset of a session")
public final class AskCommand implements Callable<Integer> {
    private final CliContext context;
    private final ObjectMapper mapper = new ObjectMapper();

    @Parameters(index = "0", arity = "1", description = "Session id")
    String sessionId;

    @Parameters(index = "1", arity = "1", description = "Question to ask")
    String prompt;

    public AskCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            Exchange exchange = context.engine().queryExecutor().submitQuery(sessionId, prompt);
            if (!exchange.succeeded()) {
                System.err.println("Error: " + exchange.errorMessage());
                return 1;
            }
            System.out.println(exchange.responseText());
            if (exchange.visualization() != null) {
                System.out.println();
                System.out.println("Visualization:");
                System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(exchange.visualization()));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Ask command failed: " + e.getMessage());
            return 1;
        }
    }
}
