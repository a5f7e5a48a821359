package io.agentfarm.runtime;

import io.agentfarm.config.FarmContext;
import io.agentfarm.model.Annotation;
import io.agentfarm.model.ArchitectState;
import io.agentfarm.model.Builder;
import io.agentfarm.model.UtilTerminal;
import io.agentfarm.observability.AuditLogger;
import io.agentfarm.observability.AuditLogger.AuditEvent;
import io.agentfarm.storage.StateStore;
import io.agentfarm.system.LivenessProber;
import io.agentfarm.system.Multiplexer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Compares what the store records with what is actually running after a crash.
 * Only this project's architect session name ({@code af-architect-<architectPort>}) is ever
 * considered an orphan; sessions of other port blocks are left alone whatever they are called.
 */
public final class OrphanReconciler {
    private static final Logger log = LoggerFactory.getLogger(OrphanReconciler.class);
    static final List<String> STALE_ARTIFACTS = List.of("builders.md", ".architect.pid", ".architect.log");
    /** Rows still at pid 0 are mid-spawn until this old. */
    static final long SPAWN_GRACE_MS = 60_000L;

    private final FarmContext context;
    private final StateStore store;
    private final Multiplexer multiplexer;
    private final LivenessProber prober;
    private final AuditLogger audit;

    public OrphanReconciler(FarmContext context, StateStore store, Multiplexer multiplexer,
                            LivenessProber prober, AuditLogger audit) {
        this.context = context;
        this.store = store;
        this.multiplexer = multiplexer;
        this.prober = prober;
        this.audit = audit;
    }

    public ReconcileReport reconcile(ReconcileOptions options) {
        String ownSession = context.architectSessionName();
        Optional<ArchitectState> architect = store.getArchitect();
        boolean architectAlive = architect.isPresent() && prober.isPidAlive(architect.get().pid());

        List<String> orphans = new ArrayList<>();
        for (String session : multiplexer.listSessions()) {
            if (!session.equals(ownSession)) {
                continue;
            }
            if (architectAlive && ownedBy(architect.get(), session)) {
                continue;
            }
            orphans.add(session);
        }

        List<String> deadBuilders = new ArrayList<>();
        for (Builder builder : store.listBuilders()) {
            if (isDead(builder.pid(), builder.startedAtMs())) {
                deadBuilders.add(builder.id());
            }
        }

        List<String> killed = new ArrayList<>();
        List<String> pruned = new ArrayList<>();
        if (!options.silent() && !orphans.isEmpty()) {
            log.warn("Found {} orphaned session(s) from a previous run: {}", orphans.size(), orphans);
        }
        if (options.kill()) {
            for (String session : orphans) {
                if (multiplexer.killSession(session)) {
                    killed.add(session);
                }
            }
            pruneArchitect(architect, architectAlive, pruned);
            pruneUtils(pruned);
            pruneAnnotations(pruned);
        }
        if (!options.silent() && !deadBuilders.isEmpty()) {
            log.warn("Builders with no live process (use 'af cleanup'): {}", deadBuilders);
        }
        ReconcileReport report = new ReconcileReport(orphans, killed, pruned, deadBuilders);
        if (!options.silent() && report.cleaned() > 0) {
            log.info("Cleaned up {} orphaned session(s) and {} stale record(s)", killed.size(), pruned.size());
        }
        if (options.kill() && report.cleaned() > 0) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("killed_sessions", killed);
            details.put("pruned_records", pruned);
            audit.logQuietly(AuditEvent.of("reconcile", context.projectName(), "ok", details));
        }
        return report;
    }

    /**
     * Legacy files from the shell-script era. Reported, never deleted.
     */
    public List<Path> checkStaleArtifacts() {
        Path codev = context.config().codevDir();
        List<Path> found = new ArrayList<>();
        for (String name : STALE_ARTIFACTS) {
            Path candidate = codev.resolve(name);
            if (Files.exists(candidate)) {
                found.add(candidate);
            }
        }
        if (!found.isEmpty()) {
            log.warn("Stale artifacts from an older agent-farm version (safe to delete by hand): {}", found);
        }
        return found;
    }

    private boolean ownedBy(ArchitectState architect, String session) {
        return architect.sessionName() == null || architect.sessionName().equals(session);
    }

    private void pruneArchitect(Optional<ArchitectState> architect, boolean alive, List<String> pruned) {
        if (architect.isEmpty() || alive) {
            return;
        }
        String session = architect.get().sessionName();
        if (session != null && multiplexer.hasSession(session)) {
            return;
        }
        if (store.clearArchitect()) {
            pruned.add("architect");
        }
    }

    private void pruneUtils(List<String> pruned) {
        for (UtilTerminal util : store.listUtils()) {
            if (!isDead(util.pid(), util.startedAtMs())) {
                continue;
            }
            if (util.sessionName() != null) {
                multiplexer.killSession(util.sessionName());
            }
            if (store.removeUtil(util.id())) {
                pruned.add("util:" + util.id());
            }
        }
    }

    private void pruneAnnotations(List<String> pruned) {
        for (Annotation annotation : store.listAnnotations()) {
            if (!isDead(annotation.pid(), annotation.startedAtMs())) {
                continue;
            }
            multiplexer.killSession(SessionNames.annotation(context, annotation.id()));
            if (store.removeAnnotation(annotation.id())) {
                pruned.add("annotation:" + annotation.id());
            }
        }
    }

    private boolean isDead(long pid, long startedAtMs) {
        if (pid > 0) {
            return !prober.isPidAlive(pid);
        }
        return Instant.now().toEpochMilli() - startedAtMs > SPAWN_GRACE_MS;
    }
}
