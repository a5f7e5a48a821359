package io.agentfarm.config;

import io.agentfarm.registry.PortRegistry;

import java.nio.file.Path;

/**
 * Resolved view of one project for the current invocation. Nothing here is cached
 * between invocations; call {@link #initialize} again to re-read the registry.
 */
public record FarmContext(FarmConfig config, ProjectPorts ports) {

    public static FarmContext initialize(FarmConfig config, PortRegistry registry) {
        int basePort = registry.getOrAllocate(config.projectRoot());
        return new FarmContext(config, ProjectPorts.of(basePort));
    }

    public String architectSessionName() {
        return "af-architect-" + ports.architectPort();
    }

    public String projectName() {
        Path fileName = config.projectRoot().getFileName();
        return fileName == null ? "root" : fileName.toString();
    }
}
