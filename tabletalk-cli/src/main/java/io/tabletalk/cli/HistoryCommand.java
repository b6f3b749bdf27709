package io.tabletalk.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.tabletalk.core.model.Exchange;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "history", description = "Show the exchanges of a session, oldest first")
public final class HistoryCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Session id")
    String sessionId;

    @Option(names = "--json", description = "Print exchanges as JSON")
    boolean json;

    public HistoryCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            List<Exchange> history = context.engine().queryExecutor().getHistory(sessionId);
            if (json) {
                ObjectMapper mapper = new ObjectMapper();
                mapper.registerModule(new JavaTimeModule());
                mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
                System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(history));
                return 0;
            }
            if (history.isEmpty()) {
                System.out.println("No exchanges yet.");
                return 0;
            }
            for (Exchange exchange : history) {
                System.out.println("#" + exchange.sequence() + " " + exchange.createdAt() + " " + exchange.status());
                System.out.println("> " + exchange.prompt());
                System.out.println(exchange.succeeded() ? exchange.responseText() : "Error: " + exchange.errorMessage());
                if (exchange.visualization() != null) {
                    System.out.println("[visualization]");
                }
                System.out.println();
            }
            return 0;
        } catch (Exception e) {
            System.err.println("History command failed: " + e.getMessage());
            return 1;
        }
    }
}
