package io.agentfarm.registry;

import io.agentfarm.config.ProjectPorts;
import io.agentfarm.config.RegistrySettings;
import io.agentfarm.error.ErrorKind;
import io.agentfarm.error.FarmException;
import io.agentfarm.model.PortAllocation;
import io.agentfarm.storage.Database;
import io.agentfarm.system.LivenessProber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Machine-wide assignment of port blocks to project checkouts, kept in {@code global.db}.
 * Two projects never share a base port; a project keeps its block for as long as its
 * directory exists.
 */
public final class PortRegistry {
    private static final Logger log = LoggerFactory.getLogger(PortRegistry.class);

    private final Database database;
    private final RegistrySettings settings;
    private final LivenessProber prober;
    private final LongSupplier ownerPid;

    public PortRegistry(Database database, RegistrySettings settings, LivenessProber prober) {
        this(database, settings, prober, () -> ProcessHandle.current().pid());
    }

    public PortRegistry(Database database, RegistrySettings settings, LivenessProber prober, LongSupplier ownerPid) {
        this.database = database;
        this.settings = settings;
        this.prober = prober;
        this.ownerPid = ownerPid;
    }

    public RegistrySettings settings() {
        return settings;
    }

    /**
     * Returns the project's base port, allocating the next free block on first use.
     * Idempotent per canonical path; refreshes owner pid and last-used time on every call.
     */
    public int getOrAllocate(Path projectPath) {
        String key = canonicalize(projectPath);
        long pid = ownerPid.getAsLong();
        return database.transaction("allocate port block for " + key, c -> {
            long now = Instant.now().toEpochMilli();
            Optional<Integer> existing = findBasePort(c, key);
            if (existing.isPresent()) {
                try (PreparedStatement ps = c.prepareStatement(
                        "UPDATE port_allocations SET pid=?, last_used_at_ms=? WHERE project_path=?")) {
                    ps.setLong(1, pid);
                    ps.setLong(2, now);
                    ps.setString(3, key);
                    ps.executeUpdate();
                }
                return existing.get();
            }
            int next = nextBasePort(c);
            if (next >= settings.ceiling()) {
                throw FarmException.capacity("No port blocks left: " + settings.maxBlocks()
                        + " blocks of " + settings.blockSize() + " from " + settings.floor() + " are allocated");
            }
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO port_allocations(project_path,base_port,pid,registered_at_ms,last_used_at_ms) VALUES(?,?,?,?,?)")) {
                ps.setString(1, key);
                ps.setInt(2, next);
                ps.setLong(3, pid);
                ps.setLong(4, now);
                ps.setLong(5, now);
                ps.executeUpdate();
            } catch (SQLException e) {
                throw conflictFor(c, next, e);
            }
            log.info("Allocated port block {} to {}", next, key);
            return next;
        });
    }

    public ProjectPorts projectPorts(Path projectPath) {
        return ProjectPorts.of(getOrAllocate(projectPath));
    }

    /**
     * Drops rows whose project directory is gone and clears owner pids that are no longer
     * alive. Each row is handled on its own; a failing row is logged and left in place.
     */
    public CleanupReport cleanupStale() {
        List<PortAllocation> rows = listRows();
        List<String> removed = new ArrayList<>();
        List<String> pidsCleared = new ArrayList<>();
        int remaining = 0;
        for (PortAllocation row : rows) {
            try {
                if (!prober.pathExists(Path.of(row.projectPath()))) {
                    if (deleteRow(row.projectPath())) {
                        removed.add(row.projectPath());
                        log.info("Released port block {} of missing project {}", row.basePort(), row.projectPath());
                    }
                    continue;
                }
                remaining++;
                if (row.pid() != null && !prober.isPidAlive(row.pid())) {
                    if (clearPid(row.projectPath(), row.pid())) {
                        pidsCleared.add(row.projectPath());
                    }
                }
            } catch (RuntimeException e) {
                log.warn("Skipping stale-allocation cleanup for {}: {}", row.projectPath(), e.getMessage());
            }
        }
        return new CleanupReport(removed, pidsCleared, remaining);
    }

    public List<AllocationView> listAllocations() {
        List<AllocationView> out = new ArrayList<>();
        for (PortAllocation row : listRows()) {
            out.add(new AllocationView(
                    row,
                    prober.pathExists(Path.of(row.projectPath())),
                    row.pid() != null && prober.isPidAlive(row.pid())
            ));
        }
        return out;
    }

    public boolean removeAllocation(Path projectPath) {
        String key = canonicalize(projectPath);
        boolean removed = deleteRow(key);
        if (removed) {
            log.info("Removed port allocation for {}", key);
        }
        return removed;
    }

    /**
     * Real path when the directory exists, otherwise the absolute normalized form, so a
     * deleted project still maps to the key it was registered under.
     */
    public static String canonicalize(Path projectPath) {
        if (projectPath == null) {
            throw FarmException.invalid("project path is required");
        }
        Path absolute = projectPath.toAbsolutePath().normalize();
        if (Files.exists(absolute)) {
            try {
                return absolute.toRealPath().toString();
            } catch (IOException e) {
                log.debug("Could not resolve real path of {}: {}", absolute, e.getMessage());
            }
        }
        return absolute.toString();
    }

    private List<PortAllocation> listRows() {
        return database.read("list port allocations", c -> {
            List<PortAllocation> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT project_path,base_port,pid,registered_at_ms,last_used_at_ms FROM port_allocations ORDER BY base_port");
                 ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    long pid = rs.getLong("pid");
                    out.add(new PortAllocation(
                            rs.getString("project_path"),
                            rs.getInt("base_port"),
                            rs.wasNull() ? null : pid,
                            rs.getLong("registered_at_ms"),
                            rs.getLong("last_used_at_ms")
                    ));
                }
            }
            return out;
        });
    }

    private boolean deleteRow(String key) {
        return database.transaction("remove port allocation " + key, c -> {
            try (PreparedStatement ps = c.prepareStatement("DELETE FROM port_allocations WHERE project_path=?")) {
                ps.setString(1, key);
                return ps.executeUpdate() > 0;
            }
        });
    }

    private boolean clearPid(String key, long expectedPid) {
        return database.transaction("clear pid of " + key, c -> {
            // a newer invocation may have claimed the row since it was read
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE port_allocations SET pid=? WHERE project_path=? AND pid=?")) {
                ps.setNull(1, Types.INTEGER);
                ps.setString(2, key);
                ps.setLong(3, expectedPid);
                return ps.executeUpdate() > 0;
            }
        });
    }

    private Optional<Integer> findBasePort(Connection c, String key) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT base_port FROM port_allocations WHERE project_path=?")) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(rs.getInt(1)) : Optional.empty();
            }
        }
    }

    private int nextBasePort(Connection c) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT MAX(base_port) FROM port_allocations");
             ResultSet rs = ps.executeQuery()) {
            if (rs.next()) {
                int max = rs.getInt(1);
                if (!rs.wasNull()) {
                    return Math.max(max + settings.blockSize(), settings.floor());
                }
            }
            return settings.floor();
        }
    }

    private FarmException conflictFor(Connection c, int basePort, SQLException e) throws SQLException {
        String message = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
        if (!message.contains("constraint")) {
            throw e;
        }
        String holder = "another project";
        try (PreparedStatement ps = c.prepareStatement("SELECT project_path FROM port_allocations WHERE base_port=?")) {
            ps.setInt(1, basePort);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    holder = rs.getString(1);
                }
            }
        }
        return new FarmException(ErrorKind.CONFLICT, "base port " + basePort + " already allocated to " + holder, e);
    }

    public record CleanupReport(List<String> removed, List<String> pidsCleared, int remaining) {
    }

    public record AllocationView(PortAllocation allocation, boolean exists, boolean pidAlive) {
    }
}
