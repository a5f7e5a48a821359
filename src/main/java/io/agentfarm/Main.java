package io.agentfarm;

import io.agentfarm.cli.FarmCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = FarmCommand.commandLine(new FarmCommand()).execute(args);
        System.exit(code);
    }
}
