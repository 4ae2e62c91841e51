package io.relay.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

@Command(
    name = "relay",
    mixinStandardHelpOptions = true,
    version = "relay 0.1.0",
    description = "Stream a prompt through any configured LLM provider"
)
public final class RelayCliCommand implements Runnable {

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }
}
