package io.agentfarm.system;

import java.nio.file.Path;
import java.util.List;

/**
 * Named, detachable terminal sessions.
 */
public interface Multiplexer {
    List<String> listSessions();

    boolean hasSession(String name);

    void createSession(String name, Path workDir, String command);

    /**
     * @return false when no session had this name
     */
    boolean killSession(String name);
}
