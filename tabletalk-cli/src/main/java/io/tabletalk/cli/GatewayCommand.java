package io.tabletalk.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

@Command(name = "gateway", description = "Serve queries and history over HTTP until interrupted")
public final class GatewayCommand implements Callable<Integer> {
    private final CliContext context;

    @Spec
    CommandSpec spec;

    @Option(names = "--host", description = "Interface to bind (default: ${DEFAULT-VALUE})", defaultValue = "0.0.0.0")
    String host;

    @Option(names = "--port", description = "Port to bind, 0 picks a free one (default: ${DEFAULT-VALUE})", defaultValue = "8787")
    int port;

    public GatewayCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        if (port < 0 || port > 65_535) {
            throw new ParameterException(spec.commandLine(), "--port must be between 0 and 65535, was " + port);
        }
        try {
            return context.gatewayRunner().run(host, port);
        } catch (Exception e) {
            System.err.println("Gateway failed on " + host + ":" + port + ": " + e.getMessage());
            return 1;
        }
    }
}
