package io.agentfarm.storage;

import io.agentfarm.config.FarmConfig;
import io.agentfarm.error.ErrorKind;
import io.agentfarm.error.FarmException;
import io.agentfarm.util.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One SQLite file plus its schema and one-time migrations. Every call opens its own
 * connection; nothing read from the file is cached across calls.
 */
public final class Database {
    private static final Logger log = LoggerFactory.getLogger(Database.class);
    private static final String MIGRATION_SCHEMA_VERSION = "agentfarm.schema.migration.v1";
    public static final int BUSY_TIMEOUT_MS = 5000;
    public static final int MAX_ATTEMPTS = 2;

    private final Path dbFile;
    private final String jdbcUrl;
    private final List<String> schema;
    private final List<SchemaMigration> migrations;

    public Database(Path dbFile, List<String> schema, List<SchemaMigration> migrations) {
        this.dbFile = dbFile.toAbsolutePath().normalize();
        this.jdbcUrl = "jdbc:sqlite:" + this.dbFile;
        this.schema = List.copyOf(schema);
        this.migrations = List.copyOf(migrations);
    }

    public static Database forProjectState(FarmConfig config) {
        return new Database(
                config.stateDb(),
                Schemas.projectState(),
                List.of(new LegacyStateImporter(config.legacyStateJson()))
        );
    }

    public static Database forRegistry(FarmConfig config) {
        return new Database(
                config.registryDb(),
                Schemas.registry(config.registrySettings()),
                List.of(new LegacyPortsImporter(config.legacyPortsJson(), config.registrySettings()))
        );
    }

    public Path dbFile() {
        return dbFile;
    }

    public void init() {
        initDirectories();
        withRetry("apply SQLite pragmas", () -> {
            applyAndValidatePragmas();
            return null;
        });
        withRetry("initialize SQLite schema", () -> {
            initSchema();
            return null;
        });
        for (SchemaMigration migration : migrations) {
            applyMigration(migration);
        }
    }

    public Connection openConnection() throws SQLException {
        SQLiteConfig cfg = new SQLiteConfig();
        cfg.setBusyTimeout(BUSY_TIMEOUT_MS);
        cfg.enforceForeignKeys(true);
        cfg.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        return DriverManager.getConnection(jdbcUrl, cfg.toProperties());
    }

    /**
     * Runs {@code call}, repeating it once when SQLite still reports busy or locked after the
     * connection's busy timeout. Constraint violations become {@link ErrorKind#CONFLICT}.
     */
    public <T> T withRetry(String action, SqlCall<T> call) {
        SQLException last = null;
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            try {
                return call.call();
            } catch (SQLException e) {
                if (!SqlErrors.isBusy(e)) {
                    throw translate(action, e);
                }
                last = e;
                log.warn("Database {} busy during '{}' (attempt {}/{})", dbFile, action, attempt, MAX_ATTEMPTS);
            }
        }
        throw new FarmException(ErrorKind.CONTENTION,
                "Database busy after " + MAX_ATTEMPTS + " attempts: " + action + " (" + dbFile + ")", last);
    }

    public <T> T read(String action, ConnectionWork<T> work) {
        return withRetry(action, () -> {
            try (Connection c = openConnection()) {
                return work.apply(c);
            }
        });
    }

    /**
     * Runs {@code work} inside {@code BEGIN IMMEDIATE}: the write lock is taken up front, so
     * two writers never both read the same snapshot before writing.
     */
    public <T> T transaction(String action, ConnectionWork<T> work) {
        return withRetry(action, () -> {
            try (Connection c = openConnection()) {
                return inImmediateTransaction(c, work);
            }
        });
    }

    /**
     * Runs several reads against one consistent WAL snapshot.
     */
    public <T> T snapshot(String action, ConnectionWork<T> work) {
        return withRetry(action, () -> {
            try (Connection c = openConnection()) {
                return inTransaction(c, "BEGIN DEFERRED", work);
            }
        });
    }

    static <T> T inImmediateTransaction(Connection c, ConnectionWork<T> work) throws SQLException {
        return inTransaction(c, "BEGIN IMMEDIATE", work);
    }

    private static <T> T inTransaction(Connection c, String begin, ConnectionWork<T> work) throws SQLException {
        try (Statement st = c.createStatement()) {
            st.execute(begin);
        }
        try {
            T out = work.apply(c);
            try (Statement st = c.createStatement()) {
                st.execute("COMMIT");
            }
            return out;
        } catch (SQLException | RuntimeException e) {
            rollback(c, e);
            throw e;
        }
    }

    private static void rollback(Connection c, Exception cause) {
        try (Statement st = c.createStatement()) {
            st.execute("ROLLBACK");
        } catch (SQLException rollbackError) {
            cause.addSuppressed(rollbackError);
        }
    }

    static FarmException translate(String action, SQLException e) {
        if (SqlErrors.isConstraint(e)) {
            return new FarmException(ErrorKind.CONFLICT, "Failed to " + action + ": " + SqlErrors.message(e), e);
        }
        return new FarmException(ErrorKind.STORAGE, "Failed to " + action + ": " + SqlErrors.message(e), e);
    }

    private void initDirectories() {
        try {
            Path parent = dbFile.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new FarmException(ErrorKind.STORAGE, "Failed to create directory for " + dbFile, e);
        }
    }

    private void initSchema() throws SQLException {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            for (String sql : schema) {
                st.execute(sql);
            }
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_schema_migrations_applied ON schema_migrations(applied_at_ms)");
        }
    }

    private void applyMigration(SchemaMigration migration) {
        boolean applied = withRetry("apply migration " + migration.version(), () -> {
            try (Connection c = openConnection()) {
                return inImmediateTransaction(c, conn -> {
                    // Checked under the write lock so racing processes import at most once.
                    if (isMigrationApplied(conn, migration.version())) {
                        return false;
                    }
                    migration.apply(conn);
                    recordMigration(conn, migration);
                    return true;
                });
            }
        });
        if (applied) {
            log.info("Applied migration {} to {}", migration.version(), dbFile);
            migration.afterCommit();
        }
    }

    private boolean isMigrationApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schema_migrations WHERE version=? AND success=1 LIMIT 1")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void recordMigration(Connection conn, SchemaMigration migration) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
            ps.setString(1, migration.version());
            ps.setString(2, migration.description());
            ps.setString(3, Hashing.sha256Hex(MIGRATION_SCHEMA_VERSION + "|" + migration.version() + "|" + migration.description()));
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.executeUpdate();
        }
    }

    private void applyAndValidatePragmas() throws SQLException {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
            validatePragma(st, "foreign_keys", "1");
            validatePragma(st, "busy_timeout", String.valueOf(BUSY_TIMEOUT_MS));
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }

    public List<SchemaMigrationRow> listSchemaMigrations(int limit) {
        String sql = """
                SELECT version,description,checksum,applied_at_ms,success
                FROM schema_migrations
                ORDER BY applied_at_ms DESC, version DESC
                LIMIT ?
                """;
        int safeLimit = Math.max(1, limit);
        return read("list schema migrations", c -> {
            List<SchemaMigrationRow> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setInt(1, safeLimit);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(new SchemaMigrationRow(
                                rs.getString("version"),
                                rs.getString("description"),
                                rs.getString("checksum"),
                                rs.getLong("applied_at_ms"),
                                rs.getInt("success") == 1
                        ));
                    }
                }
            }
            return out;
        });
    }

    @FunctionalInterface
    public interface SqlCall<T> {
        T call() throws SQLException;
    }

    @FunctionalInterface
    public interface ConnectionWork<T> {
        T apply(Connection c) throws SQLException;
    }

    public record SchemaMigrationRow(
            String version,
            String description,
            String checksum,
            long appliedAtMs,
            boolean success
    ) {
    }
}
