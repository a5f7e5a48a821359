package io.agentfarm.system;

import java.nio.file.Path;

/**
 * Isolated per-builder workspaces on their own branches.
 */
public interface VersionControl {
    void createWorkspace(Path projectRoot, Path workspace, String branch);

    /**
     * True when the workspace has uncommitted changes other than the farm's own scaffold files.
     */
    boolean isDirty(Path workspace);

    /**
     * Removes the workspace directory and its registration. Tolerates a workspace that is
     * already gone. Never deletes the branch.
     */
    void removeWorkspace(Path projectRoot, Path workspace, boolean force);
}
