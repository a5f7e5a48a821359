package io.agentfarm.system;

import io.agentfarm.error.ErrorKind;
import io.agentfarm.error.FarmException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public final class TmuxMultiplexer implements Multiplexer {
    private static final Logger log = LoggerFactory.getLogger(TmuxMultiplexer.class);

    private final CommandRunner runner;

    public TmuxMultiplexer(CommandRunner runner) {
        this.runner = runner;
    }

    @Override
    public List<String> listSessions() {
        CommandResult result;
        try {
            result = runner.run(null, List.of("tmux", "list-sessions", "-F", "#{session_name}"));
        } catch (FarmException e) {
            log.debug("tmux unavailable: {}", e.getMessage());
            return List.of();
        }
        if (!result.success()) {
            // exits non-zero when no server is running
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String line : result.stdout().split("\\R")) {
            if (!line.isBlank()) {
                out.add(line.trim());
            }
        }
        return out;
    }

    @Override
    public boolean hasSession(String name) {
        try {
            return runner.run(null, List.of("tmux", "has-session", "-t", "=" + name)).success();
        } catch (FarmException e) {
            return false;
        }
    }

    @Override
    public void createSession(String name, Path workDir, String command) {
        CommandResult result = runner.run(workDir, List.of(
                "tmux", "new-session", "-d", "-s", name, "-x", "200", "-y", "50",
                "-c", workDir.toString(), command));
        if (!result.success()) {
            throw new FarmException(ErrorKind.EXTERNAL_TOOL,
                    "tmux could not create session " + name + ": " + result.diagnostic());
        }
        runner.run(null, List.of("tmux", "set-option", "-t", name, "status", "off"));
        runner.run(null, List.of("tmux", "set", "-g", "mouse", "on"));
    }

    @Override
    public boolean killSession(String name) {
        try {
            return runner.run(null, List.of("tmux", "kill-session", "-t", "=" + name)).success();
        } catch (FarmException e) {
            log.debug("tmux kill-session {} failed: {}", name, e.getMessage());
            return false;
        }
    }
}
