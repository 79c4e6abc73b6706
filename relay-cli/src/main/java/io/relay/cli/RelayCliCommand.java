package io.relay.cli;

import picocli.CommandLine.Command;

@Command(name = "relay", mixinStandardHelpOptions = true, description = "Agent session orchestrator")
public final class RelayCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
