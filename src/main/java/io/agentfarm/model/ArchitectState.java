package io.agentfarm.model;

public record ArchitectState(
        long pid,
        int port,
        String cmd,
        long startedAtMs,
        String sessionName
) {
}
