package io.agentfarm.config;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public final class FarmConfig {
    public static final String STATE_DIR = ".agent-farm";
    public static final String BUILDERS_DIR = ".builders";
    public static final String CODEV_DIR = "codev";
    public static final String DEFAULT_REGISTRY_DIR = ".agent-farm";
    public static final String REGISTRY_DIR_ENV = "AF_REGISTRY_DIR";
    public static final String LOCALHOST = "127.0.0.1";
    public static final String ANY_HOST = "0.0.0.0";

    private final Path projectRoot;
    private final Path registryDir;
    private final RegistrySettings registrySettings;
    private final boolean allowInsecureRemote;

    public FarmConfig(Path projectRoot, Path registryDir, RegistrySettings registrySettings, boolean allowInsecureRemote) {
        this.projectRoot = projectRoot.toAbsolutePath().normalize();
        this.registryDir = registryDir.toAbsolutePath().normalize();
        this.registrySettings = registrySettings == null ? RegistrySettings.defaults() : registrySettings;
        this.allowInsecureRemote = allowInsecureRemote;
    }

    public static FarmConfig resolve(String project, String registryDir) {
        return resolve(project, registryDir, false);
    }

    public static FarmConfig resolve(String project, String registryDir, boolean allowInsecureRemote) {
        Path root = project == null || project.isBlank()
                ? findProjectRoot(Paths.get("").toAbsolutePath())
                : Paths.get(project).toAbsolutePath().normalize();
        return new FarmConfig(root, resolveRegistryDir(registryDir), RegistrySettings.defaults(), allowInsecureRemote);
    }

    static Path resolveRegistryDir(String raw) {
        if (raw != null && !raw.isBlank()) {
            return Paths.get(raw);
        }
        String env = System.getenv(REGISTRY_DIR_ENV);
        if (env != null && !env.isBlank()) {
            return Paths.get(env.trim());
        }
        return Paths.get(System.getProperty("user.home"), DEFAULT_REGISTRY_DIR);
    }

    /**
     * Walks up from {@code start} to the first directory holding {@code codev/} or {@code .git}.
     * Falls back to {@code start} itself.
     */
    public static Path findProjectRoot(Path start) {
        Path dir = start.toAbsolutePath().normalize();
        while (dir != null) {
            if (Files.isDirectory(dir.resolve(CODEV_DIR)) || Files.exists(dir.resolve(".git"))) {
                return dir;
            }
            dir = dir.getParent();
        }
        return start.toAbsolutePath().normalize();
    }

    public Path projectRoot() {
        return projectRoot;
    }

    public Path registryDir() {
        return registryDir;
    }

    public RegistrySettings registrySettings() {
        return registrySettings;
    }

    public boolean allowInsecureRemote() {
        return allowInsecureRemote;
    }

    public String bindHost() {
        return allowInsecureRemote ? ANY_HOST : LOCALHOST;
    }

    public Path stateDir() {
        return projectRoot.resolve(STATE_DIR);
    }

    public Path stateDb() {
        return stateDir().resolve("state.db");
    }

    public Path legacyStateJson() {
        return stateDir().resolve("state.json");
    }

    public Path auditFile() {
        return stateDir().resolve("audit.log");
    }

    public Path buildersDir() {
        return projectRoot.resolve(BUILDERS_DIR);
    }

    public Path codevDir() {
        return projectRoot.resolve(CODEV_DIR);
    }

    public Path userConfigFile() {
        return codevDir().resolve("config.json");
    }

    public Path registryDb() {
        return registryDir.resolve("global.db");
    }

    public Path legacyPortsJson() {
        return registryDir.resolve("ports.json");
    }
}
