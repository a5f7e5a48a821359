package io.agentfarm.storage;

import io.agentfarm.error.ErrorKind;
import io.agentfarm.error.FarmException;
import io.agentfarm.model.Annotation;
import io.agentfarm.model.AnnotationParent;
import io.agentfarm.model.ArchitectState;
import io.agentfarm.model.Builder;
import io.agentfarm.model.BuilderKind;
import io.agentfarm.model.BuilderStatus;
import io.agentfarm.model.FarmState;
import io.agentfarm.model.UtilTerminal;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Per-project record of the architect, builders, util terminals and annotation viewers.
 * Each public method is one atomic unit against {@code state.db}.
 */
public final class StateStore {
    private static final String BUILDER_COLUMNS =
            "id,name,port,pid,status,phase,workspace,branch,session_name,kind,task_text,protocol_name,started_at_ms,updated_at_ms";

    private final Database database;

    public StateStore(Database database) {
        this.database = database;
    }

    public Database database() {
        return database;
    }

    // ---- architect ----

    public void setArchitect(ArchitectState architect) {
        database.transaction("set architect", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT OR REPLACE INTO architect(id,pid,port,cmd,started_at_ms,session_name) VALUES(1,?,?,?,?,?)")) {
                ps.setLong(1, architect.pid());
                ps.setInt(2, architect.port());
                ps.setString(3, architect.cmd() == null ? "" : architect.cmd());
                ps.setLong(4, architect.startedAtMs() > 0 ? architect.startedAtMs() : nowMs());
                setNullableString(ps, 5, architect.sessionName());
                ps.executeUpdate();
            }
            return null;
        });
    }

    public Optional<ArchitectState> getArchitect() {
        return database.read("read architect", this::readArchitect);
    }

    public boolean clearArchitect() {
        return database.transaction("clear architect", c -> {
            try (Statement st = c.createStatement()) {
                return st.executeUpdate("DELETE FROM architect") > 0;
            }
        });
    }

    private Optional<ArchitectState> readArchitect(Connection c) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT pid,port,cmd,started_at_ms,session_name FROM architect WHERE id=1");
             ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) {
                return Optional.empty();
            }
            return Optional.of(new ArchitectState(
                    rs.getLong("pid"),
                    rs.getInt("port"),
                    rs.getString("cmd"),
                    rs.getLong("started_at_ms"),
                    rs.getString("session_name")
            ));
        }
    }

    // ---- builders ----

    /**
     * Inserts a new builder row. Fails with {@link ErrorKind#CONFLICT} when the id exists or the
     * port is held by another builder.
     */
    public Builder insertBuilder(Builder builder) {
        return database.transaction("insert builder " + builder.id(), c -> {
            if (findBuilder(c, builder.id()).isPresent()) {
                throw FarmException.conflict("builder " + builder.id() + " already exists");
            }
            requirePortFree(c, builder);
            long now = nowMs();
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO builders(" + BUILDER_COLUMNS + ") VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?,?)")) {
                bindBuilder(ps, builder, now);
                ps.executeUpdate();
            } catch (SQLException e) {
                throw builderConflict(builder, e);
            }
            return findBuilder(c, builder.id()).orElseThrow();
        });
    }

    /**
     * Inserts or replaces the builder with the same id, keeping its original start time.
     */
    public Builder upsertBuilder(Builder builder) {
        return database.transaction("upsert builder " + builder.id(), c -> {
            requirePortFree(c, builder);
            long now = nowMs();
            try (PreparedStatement ps = c.prepareStatement("""
                    INSERT INTO builders(%s) VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?,?)
                    ON CONFLICT(id) DO UPDATE SET
                        name=excluded.name,
                        port=excluded.port,
                        pid=excluded.pid,
                        status=excluded.status,
                        phase=excluded.phase,
                        workspace=excluded.workspace,
                        branch=excluded.branch,
                        session_name=excluded.session_name,
                        kind=excluded.kind,
                        task_text=excluded.task_text,
                        protocol_name=excluded.protocol_name
                    """.formatted(BUILDER_COLUMNS))) {
                bindBuilder(ps, builder, now);
                ps.executeUpdate();
            } catch (SQLException e) {
                throw builderConflict(builder, e);
            }
            return findBuilder(c, builder.id()).orElseThrow();
        });
    }

    public Optional<Builder> getBuilder(String id) {
        return database.read("read builder " + id, c -> findBuilder(c, id));
    }

    public List<Builder> listBuilders() {
        return database.read("list builders", this::readBuilders);
    }

    public List<Builder> listBuildersByStatus(BuilderStatus status) {
        return database.read("list builders by status", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT " + BUILDER_COLUMNS + " FROM builders WHERE status=? ORDER BY started_at_ms, id")) {
                ps.setString(1, status.wireName());
                return collectBuilders(ps);
            }
        });
    }

    public boolean removeBuilder(String id) {
        return database.transaction("remove builder " + id, c -> deleteById(c, "builders", id));
    }

    /**
     * Updates only the status column. Returns empty when no builder has this id; never inserts.
     */
    public Optional<Builder> setStatus(String id, BuilderStatus status) {
        return updateBuilderColumn("status", id, status.wireName());
    }

    /**
     * Moves the builder to {@code target} only if it is still in {@code expected}.
     * Empty when the row is gone or another invocation changed the status first.
     */
    public Optional<Builder> compareAndSetStatus(String id, BuilderStatus expected, BuilderStatus target) {
        return database.transaction("move builder " + id + " to " + target.wireName(), c -> {
            try (PreparedStatement ps = c.prepareStatement("UPDATE builders SET status=? WHERE id=? AND status=?")) {
                ps.setString(1, target.wireName());
                ps.setString(2, id);
                ps.setString(3, expected.wireName());
                if (ps.executeUpdate() == 0) {
                    return Optional.empty();
                }
            }
            return findBuilder(c, id);
        });
    }

    public Optional<Builder> setPhase(String id, String phase) {
        return updateBuilderColumn("phase", id, phase == null ? "" : phase);
    }

    public Optional<Builder> setPid(String id, long pid) {
        return database.transaction("set pid of builder " + id, c -> {
            try (PreparedStatement ps = c.prepareStatement("UPDATE builders SET pid=? WHERE id=?")) {
                ps.setLong(1, pid);
                ps.setString(2, id);
                if (ps.executeUpdate() == 0) {
                    return Optional.empty();
                }
            }
            return findBuilder(c, id);
        });
    }

    public Optional<Builder> renameBuilder(String id, String name) {
        if (name == null || name.isBlank()) {
            throw FarmException.invalid("builder name must not be blank");
        }
        return updateBuilderColumn("name", id, name.trim());
    }

    private Optional<Builder> updateBuilderColumn(String column, String id, String value) {
        return database.transaction("set " + column + " of builder " + id, c -> {
            try (PreparedStatement ps = c.prepareStatement("UPDATE builders SET " + column + "=? WHERE id=?")) {
                ps.setString(1, value);
                ps.setString(2, id);
                if (ps.executeUpdate() == 0) {
                    return Optional.empty();
                }
            }
            return findBuilder(c, id);
        });
    }

    private void requirePortFree(Connection c, Builder builder) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT id FROM builders WHERE port=? AND id<>?")) {
            ps.setInt(1, builder.port());
            ps.setString(2, builder.id());
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    throw FarmException.conflict("port " + builder.port() + " already assigned to builder " + rs.getString(1));
                }
            }
        }
    }

    private FarmException builderConflict(Builder builder, SQLException e) {
        if (SqlErrors.isUniqueViolation(e, "builders", "port")) {
            return new FarmException(ErrorKind.CONFLICT,
                    "port " + builder.port() + " already assigned to another builder", e);
        }
        if (SqlErrors.isUniqueViolation(e, "builders", "id")) {
            return new FarmException(ErrorKind.CONFLICT, "builder " + builder.id() + " already exists", e);
        }
        return Database.translate("write builder " + builder.id(), e);
    }

    private void bindBuilder(PreparedStatement ps, Builder b, long now) throws SQLException {
        ps.setString(1, b.id());
        ps.setString(2, b.name() == null || b.name().isBlank() ? b.id() : b.name());
        ps.setInt(3, b.port());
        ps.setLong(4, b.pid());
        ps.setString(5, (b.status() == null ? BuilderStatus.SPAWNING : b.status()).wireName());
        ps.setString(6, b.phase() == null ? "" : b.phase());
        ps.setString(7, b.workspace() == null ? "" : b.workspace());
        ps.setString(8, b.branch() == null ? "" : b.branch());
        setNullableString(ps, 9, b.sessionName());
        ps.setString(10, (b.kind() == null ? BuilderKind.SPEC : b.kind()).wireName());
        setNullableString(ps, 11, b.taskText());
        setNullableString(ps, 12, b.protocolName());
        ps.setLong(13, b.startedAtMs() > 0 ? b.startedAtMs() : now);
        ps.setLong(14, now);
    }

    private Optional<Builder> findBuilder(Connection c, String id) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + BUILDER_COLUMNS + " FROM builders WHERE id=?")) {
            ps.setString(1, id);
            List<Builder> rows = collectBuilders(ps);
            return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
        }
    }

    private List<Builder> readBuilders(Connection c) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT " + BUILDER_COLUMNS + " FROM builders ORDER BY started_at_ms, id")) {
            return collectBuilders(ps);
        }
    }

    private List<Builder> collectBuilders(PreparedStatement ps) throws SQLException {
        List<Builder> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new Builder(
                        rs.getString("id"),
                        rs.getString("name"),
                        rs.getInt("port"),
                        rs.getLong("pid"),
                        BuilderStatus.fromWire(rs.getString("status")),
                        rs.getString("phase"),
                        rs.getString("workspace"),
                        rs.getString("branch"),
                        rs.getString("session_name"),
                        BuilderKind.fromWire(rs.getString("kind")),
                        rs.getString("task_text"),
                        rs.getString("protocol_name"),
                        rs.getLong("started_at_ms"),
                        rs.getLong("updated_at_ms")
                ));
            }
        }
        return out;
    }

    // ---- utils ----

    public UtilTerminal addUtil(UtilTerminal util) {
        return database.transaction("add util " + util.id(), c -> {
            try {
                insertUtil(c, util);
            } catch (SQLException e) {
                if (SqlErrors.isUniqueViolation(e, "utils", "port")) {
                    throw new FarmException(ErrorKind.CONFLICT, "port " + util.port() + " already assigned to a util terminal", e);
                }
                if (SqlErrors.isUniqueViolation(e, "utils", "id")) {
                    throw new FarmException(ErrorKind.CONFLICT, "util " + util.id() + " already exists", e);
                }
                throw e;
            }
            return findUtil(c, util.id()).orElseThrow();
        });
    }

    /**
     * Like {@link #addUtil} but reports a port collision as {@code false}, so callers can
     * probe the next port.
     */
    public boolean tryAddUtil(UtilTerminal util) {
        return database.transaction("add util " + util.id(), c -> {
            try {
                insertUtil(c, util);
                return true;
            } catch (SQLException e) {
                if (SqlErrors.isUniqueViolation(e, "utils", "port")) {
                    return false;
                }
                throw e;
            }
        });
    }

    public Optional<UtilTerminal> getUtil(String id) {
        return database.read("read util " + id, c -> findUtil(c, id));
    }

    public List<UtilTerminal> listUtils() {
        return database.read("list utils", this::readUtils);
    }

    public boolean removeUtil(String id) {
        return database.transaction("remove util " + id, c -> deleteById(c, "utils", id));
    }

    public Optional<UtilTerminal> renameUtil(String id, String name) {
        if (name == null || name.isBlank()) {
            throw FarmException.invalid("util name must not be blank");
        }
        return database.transaction("rename util " + id, c -> {
            try (PreparedStatement ps = c.prepareStatement("UPDATE utils SET name=? WHERE id=?")) {
                ps.setString(1, name.trim());
                ps.setString(2, id);
                if (ps.executeUpdate() == 0) {
                    return Optional.empty();
                }
            }
            return findUtil(c, id);
        });
    }

    public Optional<UtilTerminal> setUtilPid(String id, long pid) {
        return database.transaction("set pid of util " + id, c -> {
            try (PreparedStatement ps = c.prepareStatement("UPDATE utils SET pid=? WHERE id=?")) {
                ps.setLong(1, pid);
                ps.setString(2, id);
                if (ps.executeUpdate() == 0) {
                    return Optional.empty();
                }
            }
            return findUtil(c, id);
        });
    }

    private void insertUtil(Connection c, UtilTerminal util) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO utils(id,name,port,pid,session_name,started_at_ms) VALUES(?,?,?,?,?,?)")) {
            ps.setString(1, util.id());
            ps.setString(2, util.name() == null || util.name().isBlank() ? util.id() : util.name());
            ps.setInt(3, util.port());
            ps.setLong(4, util.pid());
            setNullableString(ps, 5, util.sessionName());
            ps.setLong(6, util.startedAtMs() > 0 ? util.startedAtMs() : nowMs());
            ps.executeUpdate();
        }
    }

    private Optional<UtilTerminal> findUtil(Connection c, String id) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT id,name,port,pid,session_name,started_at_ms FROM utils WHERE id=?")) {
            ps.setString(1, id);
            List<UtilTerminal> rows = collectUtils(ps);
            return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
        }
    }

    private List<UtilTerminal> readUtils(Connection c) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT id,name,port,pid,session_name,started_at_ms FROM utils ORDER BY started_at_ms, id")) {
            return collectUtils(ps);
        }
    }

    private List<UtilTerminal> collectUtils(PreparedStatement ps) throws SQLException {
        List<UtilTerminal> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new UtilTerminal(
                        rs.getString("id"),
                        rs.getString("name"),
                        rs.getInt("port"),
                        rs.getLong("pid"),
                        rs.getString("session_name"),
                        rs.getLong("started_at_ms")
                ));
            }
        }
        return out;
    }

    // ---- annotations ----

    /**
     * Inserts an annotation after checking, under the same write lock, that its builder or
     * util parent exists.
     */
    public Annotation addAnnotation(Annotation annotation) {
        AnnotationParent parent = annotation.parent();
        return database.transaction("add annotation " + annotation.id(), c -> {
            switch (parent.kind()) {
                case BUILDER -> {
                    if (findBuilder(c, parent.id()).isEmpty()) {
                        throw FarmException.notFound("annotation parent builder " + parent.id() + " does not exist");
                    }
                }
                case UTIL -> {
                    if (findUtil(c, parent.id()).isEmpty()) {
                        throw FarmException.notFound("annotation parent util " + parent.id() + " does not exist");
                    }
                }
                case ARCHITECT -> {
                    // no row to check
                }
            }
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO annotations(id,file,port,pid,parent_kind,parent_id,started_at_ms) VALUES(?,?,?,?,?,?,?)")) {
                ps.setString(1, annotation.id());
                ps.setString(2, annotation.file());
                ps.setInt(3, annotation.port());
                ps.setLong(4, annotation.pid());
                ps.setString(5, parent.kind().wireName());
                setNullableString(ps, 6, parent.id());
                ps.setLong(7, annotation.startedAtMs() > 0 ? annotation.startedAtMs() : nowMs());
                ps.executeUpdate();
            } catch (SQLException e) {
                if (SqlErrors.isUniqueViolation(e, "annotations", "port")) {
                    throw new FarmException(ErrorKind.CONFLICT, "port " + annotation.port() + " already assigned to an annotation viewer", e);
                }
                throw e;
            }
            return annotation;
        });
    }

    public List<Annotation> listAnnotations() {
        return database.read("list annotations", this::readAnnotations);
    }

    public boolean removeAnnotation(String id) {
        return database.transaction("remove annotation " + id, c -> deleteById(c, "annotations", id));
    }

    public Optional<Annotation> getAnnotation(String id) {
        return database.read("read annotation " + id, c -> findAnnotation(c, id));
    }

    public Optional<Annotation> setAnnotationPid(String id, long pid) {
        return database.transaction("set pid of annotation " + id, c -> {
            try (PreparedStatement ps = c.prepareStatement("UPDATE annotations SET pid=? WHERE id=?")) {
                ps.setLong(1, pid);
                ps.setString(2, id);
                if (ps.executeUpdate() == 0) {
                    return Optional.empty();
                }
            }
            return findAnnotation(c, id);
        });
    }

    private Optional<Annotation> findAnnotation(Connection c, String id) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT id,file,port,pid,parent_kind,parent_id,started_at_ms FROM annotations WHERE id=?")) {
            ps.setString(1, id);
            List<Annotation> rows = collectAnnotations(ps);
            return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
        }
    }

    private List<Annotation> readAnnotations(Connection c) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT id,file,port,pid,parent_kind,parent_id,started_at_ms FROM annotations ORDER BY started_at_ms, id")) {
            return collectAnnotations(ps);
        }
    }

    private List<Annotation> collectAnnotations(PreparedStatement ps) throws SQLException {
        List<Annotation> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new Annotation(
                        rs.getString("id"),
                        rs.getString("file"),
                        rs.getInt("port"),
                        rs.getLong("pid"),
                        new AnnotationParent(
                                AnnotationParent.Kind.fromWire(rs.getString("parent_kind")),
                                rs.getString("parent_id")),
                        rs.getLong("started_at_ms")
                ));
            }
        }
        return out;
    }

    // ---- whole project ----

    public FarmState loadAll() {
        return database.snapshot("load farm state", c -> new FarmState(
                readArchitect(c).orElse(null),
                readBuilders(c),
                readUtils(c),
                readAnnotations(c)
        ));
    }

    /**
     * Every port recorded in any table of this project.
     */
    public Set<Integer> usedPorts() {
        return database.read("list used ports", c -> {
            Set<Integer> ports = new TreeSet<>();
            try (PreparedStatement ps = c.prepareStatement("""
                    SELECT port FROM architect
                    UNION SELECT port FROM builders
                    UNION SELECT port FROM utils
                    UNION SELECT port FROM annotations
                    """);
                 ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    ports.add(rs.getInt(1));
                }
            }
            return ports;
        });
    }

    public void clearAll() {
        database.transaction("clear farm state", c -> {
            try (Statement st = c.createStatement()) {
                st.executeUpdate("DELETE FROM annotations");
                st.executeUpdate("DELETE FROM utils");
                st.executeUpdate("DELETE FROM builders");
                st.executeUpdate("DELETE FROM architect");
            }
            return null;
        });
    }

    private boolean deleteById(Connection c, String table, String id) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("DELETE FROM " + table + " WHERE id=?")) {
            ps.setString(1, id);
            return ps.executeUpdate() > 0;
        }
    }

    private static void setNullableString(PreparedStatement ps, int index, String value) throws SQLException {
        if (value == null || value.isBlank()) {
            ps.setNull(index, Types.VARCHAR);
        } else {
            ps.setString(index, value);
        }
    }

    private static long nowMs() {
        return Instant.now().toEpochMilli();
    }
}
