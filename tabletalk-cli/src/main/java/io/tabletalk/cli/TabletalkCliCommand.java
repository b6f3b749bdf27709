package io.tabletalk.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

@Command(
    name = "tabletalk",
    mixinStandardHelpOptions = true,
    version = "tabletalk 0.1.0",
    description = "Ask questions about tabular datasets",
    footer = {"", "Start with: tabletalk onboard, then tabletalk ingest <file.json>"}
)
public final class TabletalkCliCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }
}
