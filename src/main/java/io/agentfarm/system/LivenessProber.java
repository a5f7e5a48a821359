package io.agentfarm.system;

import java.nio.file.Path;

/**
 * Point-in-time answers about the host. Results can be stale the moment they return.
 */
public interface LivenessProber {
    boolean isPidAlive(long pid);

    boolean pathExists(Path path);

    /**
     * True when a listener could bind {@code port} on localhost right now.
     */
    boolean isPortFree(int port);
}
