package io.agentfarm.testing;

import io.agentfarm.error.ErrorKind;
import io.agentfarm.error.FarmException;
import io.agentfarm.system.VersionControl;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Workspaces are plain directories; dirtiness is whatever the test says.
 */
public final class FakeVersionControl implements VersionControl {
    private final Map<Path, String> branches = new LinkedHashMap<>();
    private final Set<Path> dirty = ConcurrentHashMap.newKeySet();
    private boolean failCreate;

    public synchronized void failNextCreate() {
        failCreate = true;
    }

    public void markDirty(Path workspace) {
        dirty.add(workspace.toAbsolutePath().normalize());
    }

    public synchronized Map<Path, String> branches() {
        return Map.copyOf(branches);
    }

    @Override
    public synchronized void createWorkspace(Path projectRoot, Path workspace, String branch) {
        if (failCreate) {
            failCreate = false;
            throw new FarmException(ErrorKind.EXTERNAL_TOOL, "git worktree add failed: fake failure");
        }
        try {
            Files.createDirectories(workspace);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        branches.put(workspace.toAbsolutePath().normalize(), branch);
    }

    @Override
    public boolean isDirty(Path workspace) {
        return Files.isDirectory(workspace) && dirty.contains(workspace.toAbsolutePath().normalize());
    }

    @Override
    public void removeWorkspace(Path projectRoot, Path workspace, boolean force) {
        if (!Files.exists(workspace)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(workspace)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        dirty.remove(workspace.toAbsolutePath().normalize());
    }
}
