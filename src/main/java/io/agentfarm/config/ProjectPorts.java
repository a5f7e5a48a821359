package io.agentfarm.config;

/**
 * Role ranges inside one project's port block. Ranges are inclusive.
 */
public record ProjectPorts(
        int basePort,
        int dashboardPort,
        int architectPort,
        int builderPortStart,
        int builderPortEnd,
        int utilPortStart,
        int utilPortEnd,
        int annotatePortStart,
        int annotatePortEnd
) {
    public static ProjectPorts of(int basePort) {
        return new ProjectPorts(
                basePort,
                basePort,
                basePort + 1,
                basePort + 10,
                basePort + 29,
                basePort + 30,
                basePort + 49,
                basePort + 50,
                basePort + 69
        );
    }

    public boolean isBuilderPort(int port) {
        return port >= builderPortStart && port <= builderPortEnd;
    }
}
