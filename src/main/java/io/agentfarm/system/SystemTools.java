package io.agentfarm.system;

import io.agentfarm.config.FarmConfig;

/**
 * The external collaborators one invocation talks to.
 */
public record SystemTools(
        Multiplexer multiplexer,
        TerminalBridge bridge,
        VersionControl versionControl,
        LivenessProber prober,
        ProcessControl processes
) {
    public static SystemTools host(FarmConfig config) {
        CommandRunner runner = new CommandRunner();
        return new SystemTools(
                new TmuxMultiplexer(runner),
                new TtydBridge(runner, config.bindHost(), config.stateDir()),
                new GitVersionControl(runner),
                new OsLivenessProber(),
                new ProcessControl()
        );
    }
}
