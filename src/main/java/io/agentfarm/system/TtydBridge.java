package io.agentfarm.system;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public final class TtydBridge implements TerminalBridge {
    private final CommandRunner runner;
    private final String bindHost;
    private final Path logDir;

    public TtydBridge(CommandRunner runner, String bindHost, Path logDir) {
        this.runner = runner;
        this.bindHost = bindHost;
        this.logDir = logDir;
    }

    @Override
    public long start(int port, String sessionName, Path workDir) {
        List<String> command = new ArrayList<>(List.of(
                "ttyd", "-W",
                "-p", String.valueOf(port),
                "-i", bindHost,
                "-t", "rightClickSelectsWord=true"));
        // always attach by name, never to "the most recent" session
        command.addAll(List.of("tmux", "attach-session", "-t", "=" + sessionName));
        return runner.startDetached(workDir, command, logDir.resolve("ttyd-" + port + ".log"));
    }
}
