package io.agentfarm.runtime;

import io.agentfarm.config.AgentCommands;
import io.agentfarm.config.FarmContext;
import io.agentfarm.config.ProjectPorts;
import io.agentfarm.error.ErrorKind;
import io.agentfarm.error.FarmException;
import io.agentfarm.model.Builder;
import io.agentfarm.model.BuilderKind;
import io.agentfarm.model.BuilderStatus;
import io.agentfarm.observability.AuditLogger;
import io.agentfarm.observability.AuditLogger.AuditEvent;
import io.agentfarm.storage.StateStore;
import io.agentfarm.system.SystemTools;
import io.agentfarm.util.ShortIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Spawns builders and walks them through
 * {@code spawning -> implementing <-> blocked, implementing -> pr-ready -> complete}.
 * {@link #cleanup} is the abort path and works from any status.
 */
public final class BuilderLifecycle {
    private static final Logger log = LoggerFactory.getLogger(BuilderLifecycle.class);
    static final String ROLE_PREAMBLE = "You are a Builder. Read codev/roles/builder.md for your full role definition. ";

    private final FarmContext context;
    private final StateStore store;
    private final SystemTools tools;
    private final AgentCommands commands;
    private final AuditLogger audit;

    public BuilderLifecycle(FarmContext context, StateStore store, SystemTools tools,
                            AgentCommands commands, AuditLogger audit) {
        this.context = context;
        this.store = store;
        this.tools = tools;
        this.commands = commands;
        this.audit = audit;
    }

    public Builder spawn(SpawnRequest request) {
        Plan plan = plan(request);
        if (store.getBuilder(plan.id()).isPresent()) {
            throw FarmException.conflict("builder " + plan.id() + " already exists");
        }
        if (plan.workspace() != null && Files.exists(plan.workspace())) {
            throw FarmException.conflict("workspace " + plan.workspace() + " already exists");
        }

        Builder claimed = claimPort(plan);
        log.info("Spawning builder {} ({}) on port {}", claimed.id(), plan.kind(), claimed.port());

        boolean workspaceCreated = false;
        boolean sessionCreated = false;
        long bridgePid = 0L;
        try {
            Path cwd = context.config().projectRoot();
            String command = commands.builder();
            if (plan.workspace() != null) {
                Files.createDirectories(plan.workspace().getParent());
                tools.versionControl().createWorkspace(context.config().projectRoot(), plan.workspace(), plan.branch());
                workspaceCreated = true;
                cwd = plan.workspace();
                command = LaunchScripts.write(plan.workspace(), commands.builder(), plan.prompt());
            }
            tools.multiplexer().createSession(claimed.sessionName(), cwd, command);
            sessionCreated = true;
            bridgePid = tools.bridge().start(claimed.port(), claimed.sessionName(), cwd);
            Builder spawned = store.setPid(claimed.id(), bridgePid)
                    .orElseThrow(() -> FarmException.notFound("builder " + claimed.id() + " vanished during spawn"));
            audit.logQuietly(AuditEvent.of("builder.spawn", spawned.id(), "ok", AuditEvent.details(
                    "kind", plan.kind().wireName(),
                    "port", spawned.port(),
                    "branch", spawned.branch(),
                    "workspace", spawned.workspace())));
            return spawned;
        } catch (IOException | RuntimeException e) {
            compensate(claimed, plan, workspaceCreated, sessionCreated, bridgePid, e);
            audit.logQuietly(AuditEvent.of("builder.spawn", claimed.id(), "failed",
                    AuditEvent.details("error", String.valueOf(e.getMessage()))));
            if (e instanceof FarmException fe && fe.kind() == ErrorKind.EXTERNAL_TOOL) {
                throw fe;
            }
            throw new FarmException(ErrorKind.EXTERNAL_TOOL,
                    "Failed to spawn builder " + claimed.id() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Moves a builder along one edge of the status graph. Moving to {@code complete} also
     * tears the builder down, see {@link #complete}.
     */
    public Builder transition(String id, BuilderStatus target) {
        if (target == BuilderStatus.COMPLETE) {
            return complete(id);
        }
        Builder current = requireBuilder(id);
        if (current.status() == target) {
            return current;
        }
        Builder updated = moveStatus(current, target);
        audit.logQuietly(AuditEvent.of("builder.status", id, "ok", AuditEvent.details(
                "from", current.status().wireName(),
                "to", target.wireName())));
        return updated;
    }

    /**
     * Finishes a {@code pr-ready} builder: its bridge and session stop and the row goes away.
     * The workspace and branch stay for the merge.
     */
    public Builder complete(String id) {
        return complete(id, false);
    }

    /**
     * As {@link #complete(String)}; {@code force} accepts a builder in any status.
     */
    public Builder complete(String id, boolean force) {
        Builder current = requireBuilder(id);
        Builder completed = force
                ? store.setStatus(id, BuilderStatus.COMPLETE)
                    .orElseThrow(() -> FarmException.notFound("builder " + id + " not found"))
                : moveStatus(current, BuilderStatus.COMPLETE);
        stopProcesses(completed);
        store.removeBuilder(id);
        log.info("Builder {} complete; workspace {} kept", id, completed.workspace());
        audit.logQuietly(AuditEvent.of("builder.complete", id, "ok", AuditEvent.details(
                "branch", completed.branch(),
                "workspace", completed.workspace())));
        return completed;
    }

    /**
     * Stops a builder in any status and removes its workspace and row. Refuses a workspace with
     * uncommitted changes unless {@code force}. Branches are never deleted.
     */
    public CleanupResult cleanup(String id, boolean force) {
        Builder builder = requireBuilder(id);
        Path workspace = builder.hasWorkspace() ? Path.of(builder.workspace()) : null;
        if (workspace != null && !force && tools.versionControl().isDirty(workspace)) {
            throw new FarmException(ErrorKind.DIRTY_WORKSPACE,
                    "workspace " + workspace + " of builder " + id + " has uncommitted changes; commit them or pass --force");
        }
        boolean processStopped = tools.processes().terminateTree(builder.pid());
        boolean sessionKilled = builder.sessionName() != null && tools.multiplexer().killSession(builder.sessionName());
        boolean workspaceRemoved = false;
        if (workspace != null) {
            tools.versionControl().removeWorkspace(context.config().projectRoot(), workspace, force);
            workspaceRemoved = true;
        }
        store.removeBuilder(id);
        CleanupResult result = new CleanupResult(id, processStopped, sessionKilled, workspaceRemoved, builder.branch());
        log.info("Cleaned up builder {} (branch {} kept)", id, builder.branch());
        audit.logQuietly(AuditEvent.of("builder.cleanup", id, "ok", AuditEvent.details(
                "force", force,
                "session_killed", sessionKilled,
                "workspace_removed", workspaceRemoved)));
        return result;
    }

    private Builder requireBuilder(String id) {
        return store.getBuilder(id).orElseThrow(() -> FarmException.notFound("builder " + id + " not found"));
    }

    private Builder moveStatus(Builder current, BuilderStatus target) {
        if (!current.status().canMoveTo(target)) {
            throw FarmException.conflict("builder " + current.id() + " cannot move from "
                    + current.status().wireName() + " to " + target.wireName()
                    + " (allowed: " + current.status().successors() + ")");
        }
        Optional<Builder> updated = store.compareAndSetStatus(current.id(), current.status(), target);
        if (updated.isPresent()) {
            return updated.get();
        }
        if (store.getBuilder(current.id()).isEmpty()) {
            throw FarmException.notFound("builder " + current.id() + " not found");
        }
        throw FarmException.conflict("builder " + current.id() + " changed status concurrently; retry");
    }

    private void stopProcesses(Builder builder) {
        tools.processes().terminateTree(builder.pid());
        if (builder.sessionName() != null) {
            tools.multiplexer().killSession(builder.sessionName());
        }
    }

    /**
     * Inserts the row at the first builder port that no row holds and that passes a bind
     * probe. The UNIQUE constraint settles races with other invocations.
     */
    private Builder claimPort(Plan plan) {
        ProjectPorts ports = context.ports();
        Set<Integer> used = store.usedPorts();
        long now = Instant.now().toEpochMilli();
        for (int port = ports.builderPortStart(); port <= ports.builderPortEnd(); port++) {
            if (used.contains(port) || !tools.prober().isPortFree(port)) {
                continue;
            }
            Builder row = new Builder(
                    plan.id(), plan.name(), port, 0L, BuilderStatus.SPAWNING, plan.phase(),
                    plan.workspace() == null ? "" : plan.workspace().toString(),
                    plan.branch() == null ? "" : plan.branch(),
                    SessionNames.builder(context, plan.id()), plan.kind(),
                    plan.taskText(), plan.protocolName(), now, now);
            try {
                return store.insertBuilder(row);
            } catch (FarmException e) {
                if (e.kind() != ErrorKind.CONFLICT || store.getBuilder(plan.id()).isPresent()) {
                    throw e;
                }
                log.debug("Port {} taken concurrently, trying next", port);
            }
        }
        throw FarmException.capacity("No free builder port in " + ports.builderPortStart() + "-" + ports.builderPortEnd());
    }

    private void compensate(Builder claimed, Plan plan, boolean workspaceCreated, boolean sessionCreated,
                            long bridgePid, Exception cause) {
        log.warn("Spawn of builder {} failed, rolling back: {}", claimed.id(), cause.getMessage());
        try {
            if (bridgePid > 0) {
                tools.processes().terminateTree(bridgePid);
            }
            if (sessionCreated) {
                tools.multiplexer().killSession(claimed.sessionName());
            }
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
        }
        try {
            if (workspaceCreated) {
                tools.versionControl().removeWorkspace(context.config().projectRoot(), plan.workspace(), true);
            }
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
        }
        try {
            store.removeBuilder(claimed.id());
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
        }
    }

    private Plan plan(SpawnRequest request) {
        Path buildersDir = context.config().buildersDir();
        return switch (request.kind()) {
            case SPEC -> {
                Path specFile = findSpecFile(request.specId());
                String specName = stripExtension(specFile.getFileName().toString());
                String id = request.specId();
                yield new Plan(id, specName, BuilderKind.SPEC, "init",
                        buildersDir.resolve(id), "builder/" + slug(specName),
                        ROLE_PREAMBLE + specPrompt(specName), null, null);
            }
            case TASK -> {
                String id = ShortIds.prefixed("task");
                String text = request.taskText();
                yield new Plan(id, "Task: " + abbreviate(text, 30), BuilderKind.TASK, "init",
                        buildersDir.resolve(id), "builder/" + id,
                        ROLE_PREAMBLE + taskPrompt(text, request.files()), text, null);
            }
            case PROTOCOL -> {
                String protocol = request.protocolName();
                Path protocolFile = context.config().codevDir().resolve("protocols").resolve(protocol).resolve("protocol.md");
                if (!Files.isRegularFile(protocolFile)) {
                    throw FarmException.notFound("protocol " + protocol + " not found (expected " + protocolFile + ")");
                }
                String id = ShortIds.prefixed(protocol);
                yield new Plan(id, "Protocol: " + protocol, BuilderKind.PROTOCOL, "init",
                        buildersDir.resolve(id), "builder/" + id,
                        "You are running the " + protocol + " protocol. Start by reading codev/protocols/"
                                + protocol + "/protocol.md and follow its instructions.",
                        null, protocol);
            }
            case SHELL -> new Plan(ShortIds.prefixed("shell"), "Shell session", BuilderKind.SHELL, "interactive",
                    null, null, null, null, null);
            case WORKTREE -> {
                String id = ShortIds.prefixed("worktree");
                yield new Plan(id, "Worktree " + id, BuilderKind.WORKTREE, "interactive",
                        buildersDir.resolve(id), "builder/" + id, null, null, null);
            }
        };
    }

    private Path findSpecFile(String specId) {
        Path specsDir = context.config().codevDir().resolve("specs");
        if (Files.isDirectory(specsDir)) {
            List<Path> matches = new ArrayList<>();
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(specsDir, specId + "-*.md")) {
                stream.forEach(matches::add);
            } catch (IOException e) {
                throw new FarmException(ErrorKind.STORAGE, "Failed to list " + specsDir, e);
            }
            Path exact = specsDir.resolve(specId + ".md");
            if (Files.isRegularFile(exact)) {
                matches.add(exact);
            }
            if (!matches.isEmpty()) {
                matches.sort(null);
                return matches.get(0);
            }
        }
        throw FarmException.notFound("spec " + specId + " not found in " + specsDir);
    }

    static String specPrompt(String specName) {
        return "Implement the feature specified in codev/specs/" + specName + ".md. "
                + "Start by reading the spec, then begin implementation.";
    }

    static String taskPrompt(String text, List<String> files) {
        if (files.isEmpty()) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text).append("\n\nRelevant files to consider:");
        for (String file : files) {
            sb.append("\n- ").append(file);
        }
        return sb.toString();
    }

    static String slug(String value) {
        return value.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9_-]", "-")
                .replaceAll("-+", "-");
    }

    private static String stripExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private static String abbreviate(String text, int max) {
        return text.length() > max ? text.substring(0, max) + "..." : text;
    }

    private record Plan(
            String id,
            String name,
            BuilderKind kind,
            String phase,
            Path workspace,
            String branch,
            String prompt,
            String taskText,
            String protocolName
    ) {
    }

    public record CleanupResult(
            String id,
            boolean processStopped,
            boolean sessionKilled,
            boolean workspaceRemoved,
            String branchKept
    ) {
    }
}
