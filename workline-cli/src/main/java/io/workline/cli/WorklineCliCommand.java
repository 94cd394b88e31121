package io.workline.cli;

import picocli.CommandLine.Command;

@Command(name = "workline", mixinStandardHelpOptions = true, description = "Outbound interview call pipeline")
public final class WorklineCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
