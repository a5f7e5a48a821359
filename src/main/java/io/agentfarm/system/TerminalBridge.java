package io.agentfarm.system;

import java.nio.file.Path;

/**
 * Serves a multiplexer session over HTTP on one port.
 */
public interface TerminalBridge {
    /**
     * @return pid of the bridge process
     */
    long start(int port, String sessionName, Path workDir);
}
