package io.agentfarm.model;

public record UtilTerminal(
        String id,
        String name,
        int port,
        long pid,
        String sessionName,
        long startedAtMs
) {
}
