package io.agentfarm.testing;

import io.agentfarm.config.AgentCommands;
import io.agentfarm.config.FarmConfig;
import io.agentfarm.config.FarmContext;
import io.agentfarm.config.RegistrySettings;
import io.agentfarm.observability.AuditLogger;
import io.agentfarm.registry.PortRegistry;
import io.agentfarm.runtime.FarmRuntime;
import io.agentfarm.storage.Database;
import io.agentfarm.storage.StateStore;
import io.agentfarm.system.SystemTools;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * One project checkout with real SQLite files in temp directories and fake external tools.
 * Several farms may share a registry directory to act as separate projects.
 */
public final class TestFarm {
    public final Path projectRoot;
    public final FarmConfig config;
    public final FakeLivenessProber prober = new FakeLivenessProber();
    public final FakeMultiplexer multiplexer;
    public final FakeVersionControl versionControl = new FakeVersionControl();
    public final FakeTerminalBridge bridge = new FakeTerminalBridge(prober);
    public final FakeProcessControl processes = new FakeProcessControl(prober);
    public final SystemTools tools;
    public final PortRegistry registry;
    public final FarmContext context;
    public final StateStore store;
    public final AuditLogger audit;
    public final FarmRuntime runtime;

    private TestFarm(Path projectRoot, Path registryDir, FakeMultiplexer multiplexer) {
        this.projectRoot = projectRoot;
        this.multiplexer = multiplexer;
        this.tools = new SystemTools(multiplexer, bridge, versionControl, prober, processes);
        this.config = new FarmConfig(projectRoot, registryDir, RegistrySettings.defaults(), false);
        Database registryDb = Database.forRegistry(config);
        registryDb.init();
        this.registry = new PortRegistry(registryDb, config.registrySettings(), prober, () -> 4242L);
        this.context = FarmContext.initialize(config, registry);
        Database stateDb = Database.forProjectState(config);
        stateDb.init();
        this.store = new StateStore(stateDb);
        this.audit = new AuditLogger(config.auditFile(), context.projectName());
        this.runtime = new FarmRuntime(context, registry, store, tools, AgentCommands.defaults(), audit);
    }

    public static TestFarm create(String prefix) throws IOException {
        Path base = Files.createTempDirectory("agentfarm-" + prefix + "-");
        return in(base.resolve("registry"), Files.createDirectories(base.resolve("project")));
    }

    public static TestFarm in(Path registryDir, Path projectRoot) throws IOException {
        return in(registryDir, projectRoot, new FakeMultiplexer());
    }

    /**
     * Farm whose sessions live in {@code multiplexer}, as all projects on one machine share tmux.
     */
    public static TestFarm in(Path registryDir, Path projectRoot, FakeMultiplexer multiplexer) throws IOException {
        Files.createDirectories(projectRoot.resolve(FarmConfig.CODEV_DIR));
        return new TestFarm(projectRoot, registryDir, multiplexer);
    }

    public Path write(String relative, String content) throws IOException {
        Path file = projectRoot.resolve(relative);
        Files.createDirectories(file.getParent());
        return Files.writeString(file, content);
    }
}
