package io.agentfarm.model;

public record PortAllocation(
        String projectPath,
        int basePort,
        Long pid,
        long registeredAtMs,
        long lastUsedAtMs
) {
}
