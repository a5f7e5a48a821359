package io.agentfarm.runtime;

import io.agentfarm.config.AgentCommands;
import io.agentfarm.config.FarmConfig;
import io.agentfarm.config.FarmContext;
import io.agentfarm.config.ProjectPorts;
import io.agentfarm.error.ErrorKind;
import io.agentfarm.error.FarmException;
import io.agentfarm.model.Annotation;
import io.agentfarm.model.AnnotationParent;
import io.agentfarm.model.ArchitectState;
import io.agentfarm.model.Builder;
import io.agentfarm.model.FarmState;
import io.agentfarm.model.UtilTerminal;
import io.agentfarm.observability.AuditLogger;
import io.agentfarm.observability.AuditLogger.AuditEvent;
import io.agentfarm.registry.PortRegistry;
import io.agentfarm.storage.Database;
import io.agentfarm.storage.StateStore;
import io.agentfarm.system.SystemTools;
import io.agentfarm.util.ShortIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.IntPredicate;

/**
 * Everything one CLI invocation does against one project: the architect, util terminals,
 * annotation viewers, stop and status. Builders are delegated to {@link BuilderLifecycle}.
 */
public final class FarmRuntime {
    private static final Logger log = LoggerFactory.getLogger(FarmRuntime.class);

    static final int MIN_PORT = 1024;
    static final int MAX_PORT = 65535;

    private final FarmContext context;
    private final PortRegistry registry;
    private final StateStore store;
    private final SystemTools tools;
    private final AgentCommands commands;
    private final AuditLogger audit;
    private final OrphanReconciler reconciler;
    private final BuilderLifecycle builders;

    public FarmRuntime(FarmContext context, PortRegistry registry, StateStore store, SystemTools tools,
                       AgentCommands commands, AuditLogger audit) {
        this.context = context;
        this.registry = registry;
        this.store = store;
        this.tools = tools;
        this.commands = commands;
        this.audit = audit;
        this.reconciler = new OrphanReconciler(context, store, tools.multiplexer(), tools.prober(), audit);
        this.builders = new BuilderLifecycle(context, store, tools, commands, audit);
    }

    /**
     * Opens the machine registry and this project's store, allocating the project's port
     * block on first use.
     */
    public static FarmRuntime open(FarmConfig config, AgentCommands overrides) {
        SystemTools tools = SystemTools.host(config);
        PortRegistry registry = openRegistry(config, tools);
        FarmContext context = FarmContext.initialize(config, registry);
        Database stateDb = Database.forProjectState(config);
        stateDb.init();
        AuditLogger audit = new AuditLogger(config.auditFile(), context.projectName());
        return new FarmRuntime(context, registry, new StateStore(stateDb), tools, AgentCommands.resolve(config, overrides), audit);
    }

    public static PortRegistry openRegistry(FarmConfig config, SystemTools tools) {
        Database registryDb = Database.forRegistry(config);
        registryDb.init();
        return new PortRegistry(registryDb, config.registrySettings(), tools.prober());
    }

    public FarmContext context() {
        return context;
    }

    public StateStore store() {
        return store;
    }

    public BuilderLifecycle builders() {
        return builders;
    }

    public OrphanReconciler reconciler() {
        return reconciler;
    }

    public ArchitectState startArchitect(String commandOverride, Integer portOverride) {
        int port = portOverride == null ? context.ports().architectPort() : checkedOverride(portOverride);
        reconciler.reconcile(ReconcileOptions.killing());
        reconciler.checkStaleArtifacts();

        Optional<ArchitectState> existing = store.getArchitect();
        if (existing.isPresent() && tools.prober().isPidAlive(existing.get().pid())) {
            throw FarmException.conflict("architect already running (pid " + existing.get().pid()
                    + ", port " + existing.get().port() + "); run 'af stop' first");
        }
        String session = "af-architect-" + port;
        String command = commandOverride == null || commandOverride.isBlank() ? commands.architect() : commandOverride;
        Path root = context.config().projectRoot();

        if (tools.multiplexer().hasSession(session)) {
            throw FarmException.conflict("session " + session + " already exists and is not owned by a live architect");
        }
        tools.multiplexer().createSession(session, root, command);
        long pid;
        try {
            pid = tools.bridge().start(port, session, root);
        } catch (RuntimeException e) {
            tools.multiplexer().killSession(session);
            throw e;
        }
        ArchitectState architect = new ArchitectState(pid, port, command, Instant.now().toEpochMilli(), session);
        store.setArchitect(architect);
        log.info("Architect started on port {} (session {})", port, session);
        audit.logQuietly(AuditEvent.of("architect.start", session, "ok", AuditEvent.details("port", port, "pid", pid)));
        return architect;
    }

    /**
     * Stops every recorded process and session and clears the store. Workspaces and port
     * allocations stay.
     */
    public StopReport stopAll() {
        FarmState state = store.loadAll();
        List<String> stopped = new ArrayList<>();
        for (Annotation annotation : state.annotations()) {
            stop(annotation.pid(), SessionNames.annotation(context, annotation.id()));
            stopped.add("annotation:" + annotation.id());
        }
        for (UtilTerminal util : state.utils()) {
            stop(util.pid(), util.sessionName());
            stopped.add("util:" + util.id());
        }
        for (Builder builder : state.builders()) {
            stop(builder.pid(), builder.sessionName());
            stopped.add("builder:" + builder.id());
        }
        if (state.architect() != null) {
            stop(state.architect().pid(), state.architect().sessionName());
            stopped.add("architect");
        }
        store.clearAll();
        audit.logQuietly(AuditEvent.of("farm.stop", context.projectName(), "ok", AuditEvent.details("stopped", stopped)));
        return new StopReport(stopped);
    }

    public UtilTerminal spawnUtil(String name) {
        String id = ShortIds.prefixed("util");
        String session = SessionNames.util(context, id);
        String displayName = name == null || name.isBlank() ? "Shell " + id : name.trim();
        ProjectPorts ports = context.ports();
        long now = Instant.now().toEpochMilli();
        UtilTerminal claimed = claim(ports.utilPortStart(), ports.utilPortEnd(), "util", port ->
                store.tryAddUtil(new UtilTerminal(id, displayName, port, 0L, session, now)))
                .map(port -> new UtilTerminal(id, displayName, port, 0L, session, now))
                .orElseThrow(() -> FarmException.capacity("No free util port in "
                        + ports.utilPortStart() + "-" + ports.utilPortEnd()));
        Path root = context.config().projectRoot();
        boolean sessionCreated = false;
        try {
            tools.multiplexer().createSession(session, root, commands.shell());
            sessionCreated = true;
            long pid = tools.bridge().start(claimed.port(), session, root);
            UtilTerminal util = store.setUtilPid(id, pid).orElseThrow(
                    () -> FarmException.notFound("util " + id + " vanished during spawn"));
            audit.logQuietly(AuditEvent.of("util.spawn", id, "ok", AuditEvent.details("port", util.port())));
            return util;
        } catch (RuntimeException e) {
            if (sessionCreated) {
                tools.multiplexer().killSession(session);
            }
            store.removeUtil(id);
            throw e;
        }
    }

    public Annotation openAnnotation(Path file, AnnotationParent parent) {
        Path target = file.isAbsolute() ? file : context.config().projectRoot().resolve(file);
        if (!Files.isRegularFile(target)) {
            throw FarmException.notFound("file " + target + " not found");
        }
        String id = ShortIds.prefixed("ann");
        String session = SessionNames.annotation(context, id);
        ProjectPorts ports = context.ports();
        Set<Integer> used = store.usedPorts();
        long now = Instant.now().toEpochMilli();
        Annotation claimed = null;
        for (int port = ports.annotatePortStart(); port <= ports.annotatePortEnd() && claimed == null; port++) {
            if (used.contains(port) || !tools.prober().isPortFree(port)) {
                continue;
            }
            try {
                claimed = store.addAnnotation(new Annotation(id, target.toString(), port, 0L, parent, now));
            } catch (FarmException e) {
                if (e.kind() != ErrorKind.CONFLICT) {
                    throw e;
                }
            }
        }
        if (claimed == null) {
            throw FarmException.capacity("No free annotation port in " + ports.annotatePortStart() + "-" + ports.annotatePortEnd());
        }
        boolean sessionCreated = false;
        try {
            tools.multiplexer().createSession(session, target.getParent(), "less -R " + LaunchScripts.quote(target.toString()));
            sessionCreated = true;
            long pid = tools.bridge().start(claimed.port(), session, target.getParent());
            Annotation opened = store.setAnnotationPid(id, pid).orElseThrow(
                    () -> FarmException.notFound("annotation " + id + " vanished during open"));
            audit.logQuietly(AuditEvent.of("annotation.open", id, "ok",
                    AuditEvent.details("file", opened.file(), "port", opened.port())));
            return opened;
        } catch (RuntimeException e) {
            if (sessionCreated) {
                tools.multiplexer().killSession(session);
            }
            store.removeAnnotation(id);
            throw e;
        }
    }

    /**
     * Renames a builder or util terminal.
     */
    public String rename(String id, String name) {
        if (store.renameBuilder(id, name).isPresent()) {
            return "builder";
        }
        if (store.renameUtil(id, name).isPresent()) {
            return "util";
        }
        throw FarmException.notFound("no builder or util with id " + id);
    }

    public FarmStatus status() {
        FarmState state = store.loadAll();
        Live<ArchitectState> architect = state.architect() == null
                ? null
                : new Live<>(state.architect(), tools.prober().isPidAlive(state.architect().pid()));
        List<Live<Builder>> builderViews = new ArrayList<>();
        state.builders().forEach(b -> builderViews.add(new Live<>(b, tools.prober().isPidAlive(b.pid()))));
        List<Live<UtilTerminal>> utilViews = new ArrayList<>();
        state.utils().forEach(u -> utilViews.add(new Live<>(u, tools.prober().isPidAlive(u.pid()))));
        List<Live<Annotation>> annotationViews = new ArrayList<>();
        state.annotations().forEach(a -> annotationViews.add(new Live<>(a, tools.prober().isPidAlive(a.pid()))));
        return new FarmStatus(
                context.config().projectRoot().toString(),
                context.ports(),
                architect,
                builderViews,
                utilViews,
                annotationViews
        );
    }

    private Optional<Integer> claim(int start, int end, String what, IntPredicate insert) {
        Set<Integer> used = store.usedPorts();
        for (int port = start; port <= end; port++) {
            if (used.contains(port) || !tools.prober().isPortFree(port)) {
                continue;
            }
            if (insert.test(port)) {
                return Optional.of(port);
            }
            log.debug("{} port {} taken concurrently, trying next", what, port);
        }
        return Optional.empty();
    }

    private void stop(long pid, String session) {
        try {
            tools.processes().terminateTree(pid);
            if (session != null) {
                tools.multiplexer().killSession(session);
            }
        } catch (RuntimeException e) {
            log.warn("Could not stop pid {} / session {}: {}", pid, session, e.getMessage());
        }
    }

    /**
     * An explicit architect port must be a non-privileged port outside every other
     * project's block.
     */
    private int checkedOverride(int port) {
        if (port < MIN_PORT || port > MAX_PORT) {
            throw FarmException.invalid("port must be between " + MIN_PORT + " and " + MAX_PORT + ", got " + port);
        }
        int blockSize = context.config().registrySettings().blockSize();
        for (PortRegistry.AllocationView view : registry.listAllocations()) {
            int base = view.allocation().basePort();
            if (base != context.ports().basePort() && port >= base && port < base + blockSize) {
                throw FarmException.conflict("port " + port + " belongs to the block of "
                        + view.allocation().projectPath() + " (" + base + "-" + (base + blockSize - 1) + ")");
            }
        }
        return port;
    }

    public record Live<T>(T record, boolean alive) {
    }

    public record FarmStatus(
            String project,
            ProjectPorts ports,
            Live<ArchitectState> architect,
            List<Live<Builder>> builders,
            List<Live<UtilTerminal>> utils,
            List<Live<Annotation>> annotations
    ) {
    }

    public record StopReport(List<String> stopped) {
    }
}
