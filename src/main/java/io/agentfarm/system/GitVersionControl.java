package io.agentfarm.system;

import io.agentfarm.error.ErrorKind;
import io.agentfarm.error.FarmException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.List;

/**
 * Workspaces are {@code git worktree}s.
 */
public final class GitVersionControl implements VersionControl {
    private static final Logger log = LoggerFactory.getLogger(GitVersionControl.class);
    static final String SCAFFOLD_PREFIX = ".builder-";

    private final CommandRunner runner;

    public GitVersionControl(CommandRunner runner) {
        this.runner = runner;
    }

    @Override
    public void createWorkspace(Path projectRoot, Path workspace, String branch) {
        CommandResult branchResult = runner.run(projectRoot, List.of("git", "branch", branch));
        if (!branchResult.success() && !branchResult.diagnostic().contains("already exists")) {
            throw new FarmException(ErrorKind.EXTERNAL_TOOL,
                    "git could not create branch " + branch + ": " + branchResult.diagnostic());
        }
        CommandResult result = runner.run(projectRoot, List.of("git", "worktree", "add", workspace.toString(), branch));
        if (!result.success()) {
            throw new FarmException(ErrorKind.EXTERNAL_TOOL,
                    "git could not create worktree " + workspace + ": " + result.diagnostic());
        }
    }

    @Override
    public boolean isDirty(Path workspace) {
        if (!Files.isDirectory(workspace)) {
            return false;
        }
        CommandResult result = runner.run(workspace, List.of("git", "status", "--porcelain"));
        if (!result.success()) {
            throw new FarmException(ErrorKind.EXTERNAL_TOOL,
                    "git status failed in " + workspace + ": " + result.diagnostic());
        }
        return hasUserChanges(result.stdout());
    }

    static boolean hasUserChanges(String porcelain) {
        for (String line : porcelain.split("\\R")) {
            if (line.length() < 4) {
                continue;
            }
            String path = line.substring(3).trim();
            if (path.startsWith("\"")) {
                path = path.substring(1);
            }
            if (!path.startsWith(SCAFFOLD_PREFIX)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public void removeWorkspace(Path projectRoot, Path workspace, boolean force) {
        if (!Files.exists(workspace)) {
            runner.run(projectRoot, List.of("git", "worktree", "prune"));
            return;
        }
        List<String> command = force
                ? List.of("git", "worktree", "remove", "--force", workspace.toString())
                : List.of("git", "worktree", "remove", workspace.toString());
        CommandResult result = runner.run(projectRoot, command);
        if (result.success()) {
            return;
        }
        log.warn("git worktree remove failed for {} ({}), deleting directory", workspace, result.diagnostic());
        deleteRecursively(workspace);
        CommandResult prune = runner.run(projectRoot, List.of("git", "worktree", "prune"));
        if (!prune.success()) {
            log.warn("git worktree prune failed: {}", prune.diagnostic());
        }
    }

    private static void deleteRecursively(Path root) {
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                    Files.deleteIfExists(file);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                    Files.deleteIfExists(dir);
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new FarmException(ErrorKind.EXTERNAL_TOOL, "Failed to delete workspace " + root, e);
        }
    }
}
