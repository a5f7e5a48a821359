package io.agentfarm.cli;

import io.agentfarm.config.AgentCommands;
import io.agentfarm.config.FarmConfig;
import io.agentfarm.error.ErrorKind;
import io.agentfarm.error.FarmException;
import io.agentfarm.model.AnnotationParent;
import io.agentfarm.model.Builder;
import io.agentfarm.model.BuilderStatus;
import io.agentfarm.observability.AuditLogger;
import io.agentfarm.registry.PortRegistry;
import io.agentfarm.runtime.FarmRuntime;
import io.agentfarm.runtime.ReconcileOptions;
import io.agentfarm.runtime.ReconcileReport;
import io.agentfarm.runtime.SpawnRequest;
import io.agentfarm.storage.Database;
import io.agentfarm.system.SystemTools;
import io.agentfarm.util.Jsons;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "af",
        mixinStandardHelpOptions = true,
        description = "Agent farm: architect, builders and terminals for one project checkout",
        subcommands = {
                FarmCommand.StartCommand.class,
                FarmCommand.StopCommand.class,
                FarmCommand.StatusCommand.class,
                FarmCommand.SpawnCommand.class,
                FarmCommand.SetStatusCommand.class,
                FarmCommand.RenameCommand.class,
                FarmCommand.CleanupCommand.class,
                FarmCommand.UtilCommand.class,
                FarmCommand.AnnotateCommand.class,
                FarmCommand.ReconcileCommand.class,
                FarmCommand.PortsCommand.class,
                FarmCommand.DbCommand.class,
                FarmCommand.AuditCommand.class
        }
)
public final class FarmCommand implements Runnable {
    @Spec
    CommandSpec spec;

    @Option(names = {"--project"}, description = "Project root (default: nearest directory with codev/ or .git)")
    String project;

    @Option(names = {"--registry-dir"}, description = "Port registry directory (default: $AF_REGISTRY_DIR or ~/.agent-farm)")
    String registryDir;

    @Option(names = {"--allow-insecure-remote"}, description = "Bind terminal bridges to 0.0.0.0 instead of localhost")
    boolean allowInsecureRemote;

    @Option(names = {"--architect-cmd"}, description = "Override the architect agent command")
    String architectCmd;

    @Option(names = {"--builder-cmd"}, description = "Override the builder agent command")
    String builderCmd;

    @Option(names = {"--shell-cmd"}, description = "Override the util shell command")
    String shellCmd;

    private final Runtimes runtimes;

    public FarmCommand() {
        this(Runtimes.host());
    }

    public FarmCommand(Runtimes runtimes) {
        this.runtimes = runtimes;
    }

    /**
     * Command line with farm errors mapped to their exit codes and printed to stderr.
     */
    public static CommandLine commandLine(FarmCommand root) {
        CommandLine cmd = new CommandLine(root);
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            PrintWriter err = commandLine.getErr();
            err.println("af: " + ex.getMessage());
            err.flush();
            return exitCodeFor(ex);
        });
        return cmd;
    }

    static int exitCodeFor(Exception ex) {
        if (ex instanceof FarmException farm) {
            return farm.kind().exitCode();
        }
        if (ex instanceof IllegalArgumentException) {
            return ErrorKind.INVALID_ARGUMENT.exitCode();
        }
        return 1;
    }

    @Override
    public void run() {
        spec.commandLine().getOut().println("Use subcommands: start | stop | status | spawn | set-status | rename | cleanup | util | annotate | reconcile | ports | db | audit");
    }

    FarmConfig config() {
        return FarmConfig.resolve(project, registryDir, allowInsecureRemote);
    }

    FarmRuntime runtime() {
        return runtimes.open(config(), new AgentCommands(architectCmd, builderCmd, shellCmd));
    }

    PortRegistry registry() {
        return runtimes.registry(config());
    }

    void print(Object value) {
        PrintWriter out = spec.commandLine().getOut();
        out.println(Jsons.toJson(value));
        out.flush();
    }

    /**
     * How the CLI reaches the farm. Tests substitute in-memory tools.
     */
    public interface Runtimes {
        FarmRuntime open(FarmConfig config, AgentCommands overrides);

        PortRegistry registry(FarmConfig config);

        static Runtimes host() {
            return new Runtimes() {
                @Override
                public FarmRuntime open(FarmConfig config, AgentCommands overrides) {
                    return FarmRuntime.open(config, overrides);
                }

                @Override
                public PortRegistry registry(FarmConfig config) {
                    return FarmRuntime.openRegistry(config, SystemTools.host(config));
                }
            };
        }
    }

    @Command(name = "start", description = "Reconcile leftovers and start the architect session")
    static final class StartCommand implements Callable<Integer> {
        @ParentCommand
        FarmCommand parent;

        @Option(names = {"--port"}, description = "Architect bridge port (default: base port + 1)")
        Integer port;

        @Option(names = {"--cmd"}, description = "Architect command for this run")
        String cmd;

        @Override
        public Integer call() {
            parent.print(parent.runtime().startArchitect(cmd, port));
            return 0;
        }
    }

    @Command(name = "stop", description = "Stop every recorded process and session of this project")
    static final class StopCommand implements Callable<Integer> {
        @ParentCommand
        FarmCommand parent;

        @Override
        public Integer call() {
            parent.print(parent.runtime().stopAll());
            return 0;
        }
    }

    @Command(name = "status", description = "Show recorded state with liveness")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        FarmCommand parent;

        @Override
        public Integer call() {
            parent.print(parent.runtime().status());
            return 0;
        }
    }

    @Command(name = "spawn", description = "Spawn a builder; exactly one mode option is required")
    static final class SpawnCommand implements Callable<Integer> {
        @ParentCommand
        FarmCommand parent;

        @Option(names = {"-p", "--project-id"}, description = "Spec number under codev/specs")
        String specId;

        @Option(names = {"--task"}, description = "Free-text task")
        String task;

        @Option(names = {"--files"}, split = ",", description = "Files the task concerns (with --task)")
        List<String> files;

        @Option(names = {"--protocol"}, description = "Protocol under codev/protocols")
        String protocol;

        @Option(names = {"--shell"}, description = "Bare shell, no workspace")
        boolean shell;

        @Option(names = {"--worktree"}, description = "Bare workspace, no prompt")
        boolean worktree;

        @Override
        public Integer call() {
            SpawnRequest request = request();
            Builder builder = parent.runtime().builders().spawn(request);
            parent.print(builder);
            return 0;
        }

        SpawnRequest request() {
            int modes = (specId != null ? 1 : 0) + (task != null ? 1 : 0) + (protocol != null ? 1 : 0)
                    + (shell ? 1 : 0) + (worktree ? 1 : 0);
            if (modes != 1) {
                throw FarmException.invalid("spawn needs exactly one of --project-id, --task, --protocol, --shell, --worktree");
            }
            if (files != null && !files.isEmpty() && task == null) {
                throw FarmException.invalid("--files is only valid with --task");
            }
            if (specId != null) {
                return SpawnRequest.spec(specId);
            }
            if (task != null) {
                return SpawnRequest.task(task.trim(), files);
            }
            if (protocol != null) {
                return SpawnRequest.protocol(protocol);
            }
            return shell ? SpawnRequest.shell() : SpawnRequest.worktree();
        }
    }

    @Command(name = "set-status", description = "Move a builder along its lifecycle")
    static final class SetStatusCommand implements Callable<Integer> {
        @ParentCommand
        FarmCommand parent;

        @Parameters(index = "0", description = "Builder id")
        String id;

        @Parameters(index = "1", description = "spawning|implementing|blocked|pr-ready|complete")
        String status;

        @Option(names = {"--force"}, description = "Write the status without checking the transition; complete still stops the builder")
        boolean force;

        @Override
        public Integer call() {
            BuilderStatus target = BuilderStatus.fromWire(status);
            FarmRuntime runtime = parent.runtime();
            Builder updated;
            if (target == BuilderStatus.COMPLETE) {
                updated = runtime.builders().complete(id, force);
            } else if (force) {
                updated = runtime.store().setStatus(id, target)
                        .orElseThrow(() -> FarmException.notFound("builder " + id + " not found"));
            } else {
                updated = runtime.builders().transition(id, target);
            }
            parent.print(updated);
            return 0;
        }
    }

    @Command(name = "rename", description = "Rename a builder or util terminal")
    static final class RenameCommand implements Callable<Integer> {
        @ParentCommand
        FarmCommand parent;

        @Parameters(index = "0", description = "Builder or util id")
        String id;

        @Parameters(index = "1", description = "New display name")
        String name;

        @Override
        public Integer call() {
            String kind = parent.runtime().rename(id, name);
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("id", id);
            out.put("kind", kind);
            out.put("name", name.trim());
            parent.print(out);
            return 0;
        }
    }

    @Command(name = "cleanup", description = "Stop a builder and remove its workspace and record")
    static final class CleanupCommand implements Callable<Integer> {
        @ParentCommand
        FarmCommand parent;

        @Parameters(index = "0", description = "Builder id")
        String id;

        @Option(names = {"--force"}, description = "Discard uncommitted changes in the workspace")
        boolean force;

        @Override
        public Integer call() {
            parent.print(parent.runtime().builders().cleanup(id, force));
            return 0;
        }
    }

    @Command(name = "util", description = "Open a util shell terminal")
    static final class UtilCommand implements Callable<Integer> {
        @ParentCommand
        FarmCommand parent;

        @Option(names = {"--name"}, description = "Display name")
        String name;

        @Override
        public Integer call() {
            parent.print(parent.runtime().spawnUtil(name));
            return 0;
        }
    }

    @Command(name = "annotate", description = "Open an annotation viewer for a file")
    static final class AnnotateCommand implements Callable<Integer> {
        @ParentCommand
        FarmCommand parent;

        @Parameters(index = "0", description = "File to view")
        String file;

        @Option(names = {"--parent"}, defaultValue = "architect", description = "architect | builder:<id> | util:<id>")
        String parentRef;

        @Override
        public Integer call() {
            AnnotationParent owner = AnnotationParent.parse(parentRef);
            parent.print(parent.runtime().openAnnotation(Path.of(file), owner));
            return 0;
        }
    }

    @Command(name = "reconcile", description = "Report (and with --kill, clean up) leftovers of a crashed run")
    static final class ReconcileCommand implements Callable<Integer> {
        @ParentCommand
        FarmCommand parent;

        @Option(names = {"--kill"}, description = "Kill orphaned sessions and prune dead records")
        boolean kill;

        @Override
        public Integer call() {
            ReconcileReport report = parent.runtime().reconciler()
                    .reconcile(kill ? ReconcileOptions.killing() : ReconcileOptions.report());
            parent.print(report);
            return 0;
        }
    }

    @Command(
            name = "ports",
            description = "Inspect the machine-wide port registry",
            subcommands = {
                    PortsListCommand.class,
                    PortsCleanupCommand.class,
                    PortsRemoveCommand.class
            }
    )
    static final class PortsCommand implements Runnable {
        @ParentCommand
        FarmCommand parent;

        @Override
        public void run() {
            parent.spec.commandLine().getOut().println("Use subcommands: list | cleanup | remove");
        }
    }

    @Command(name = "list", description = "List every allocated port block")
    static final class PortsListCommand implements Callable<Integer> {
        @ParentCommand
        PortsCommand ports;

        @Override
        public Integer call() {
            ports.parent.print(ports.parent.registry().listAllocations());
            return 0;
        }
    }

    @Command(name = "cleanup", description = "Release blocks of deleted projects and clear dead owner pids")
    static final class PortsCleanupCommand implements Callable<Integer> {
        @ParentCommand
        PortsCommand ports;

        @Override
        public Integer call() {
            ports.parent.print(ports.parent.registry().cleanupStale());
            return 0;
        }
    }

    @Command(name = "remove", description = "Release the block of one project path")
    static final class PortsRemoveCommand implements Callable<Integer> {
        @ParentCommand
        PortsCommand ports;

        @Parameters(index = "0", description = "Project path")
        String path;

        @Override
        public Integer call() {
            if (!ports.parent.registry().removeAllocation(Path.of(path))) {
                throw FarmException.notFound("no port allocation for " + PortRegistry.canonicalize(Path.of(path)));
            }
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("removed", PortRegistry.canonicalize(Path.of(path)));
            ports.parent.print(out);
            return 0;
        }
    }

    @Command(name = "db", description = "Database maintenance", subcommands = {DbMigrationsCommand.class})
    static final class DbCommand implements Runnable {
        @ParentCommand
        FarmCommand parent;

        @Override
        public void run() {
            parent.spec.commandLine().getOut().println("Use subcommands: migrations");
        }
    }

    @Command(name = "migrations", description = "List applied schema migrations")
    static final class DbMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        DbCommand db;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows to print")
        int limit;

        @Option(names = {"--registry"}, description = "Read the machine-wide registry instead of this project's state")
        boolean registry;

        @Override
        public Integer call() {
            FarmConfig config = db.parent.config();
            Database database = registry ? Database.forRegistry(config) : Database.forProjectState(config);
            database.init();
            db.parent.print(database.listSchemaMigrations(limit));
            return 0;
        }
    }

    @Command(name = "audit", description = "Audit trail", subcommands = {AuditVerifyCommand.class})
    static final class AuditCommand implements Runnable {
        @ParentCommand
        FarmCommand parent;

        @Override
        public void run() {
            parent.spec.commandLine().getOut().println("Use subcommands: verify");
        }
    }

    @Command(name = "verify", description = "Verify the audit log hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        AuditCommand audit;

        @Override
        public Integer call() {
            FarmConfig config = audit.parent.config();
            AuditLogger logger = new AuditLogger(config.auditFile(), config.projectRoot().getFileName().toString());
            AuditLogger.VerifyResult result = logger.verify();
            audit.parent.print(result);
            return result.valid() ? 0 : 1;
        }
    }
}
