package io.agentfarm.storage;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentfarm.error.ErrorKind;
import io.agentfarm.error.FarmException;
import io.agentfarm.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Imports a project's flat-file {@code state.json} into {@code state.db}. Every row uses a plain
 * INSERT, so a duplicate id or port in the file aborts the whole import.
 */
final class LegacyStateImporter implements SchemaMigration {
    private static final Logger log = LoggerFactory.getLogger(LegacyStateImporter.class);
    static final String VERSION = "001_legacy_json_import";

    private final Path jsonFile;
    private boolean imported;

    LegacyStateImporter(Path jsonFile) {
        this.jsonFile = jsonFile;
    }

    @Override
    public String version() {
        return VERSION;
    }

    @Override
    public String description() {
        return "Import legacy state.json into state.db";
    }

    @Override
    public void apply(Connection conn) throws SQLException {
        imported = false;
        if (!Files.isRegularFile(jsonFile)) {
            return;
        }
        JsonNode state = LegacyJson.read(jsonFile);
        long nowMs = Instant.now().toEpochMilli();
        try {
            importArchitect(conn, state.path("architect"), nowMs);
            int builders = importBuilders(conn, state.path("builders"), nowMs);
            int utils = importUtils(conn, state.path("utils"), nowMs);
            int annotations = importAnnotations(conn, state.path("annotations"), nowMs);
            log.info("Importing {}: {} builders, {} utils, {} annotations", jsonFile, builders, utils, annotations);
        } catch (SQLException | FarmException e) {
            log.error("Import of {} failed, file preserved: {}", jsonFile, e.getMessage());
            throw e;
        }
        imported = true;
    }

    @Override
    public void afterCommit() {
        if (imported) {
            LegacyJson.backup(jsonFile);
        }
    }

    private void importArchitect(Connection conn, JsonNode a, long nowMs) throws SQLException {
        if (a.isMissingNode() || a.isNull()) {
            return;
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO architect(id,pid,port,cmd,started_at_ms,session_name) VALUES(1,?,?,?,?,?)")) {
            ps.setLong(1, a.path("pid").asLong(0L));
            ps.setInt(2, requiredPort(a, "architect"));
            ps.setString(3, a.path("cmd").asText(""));
            ps.setLong(4, LegacyJson.epochMs(a.path("startedAt"), nowMs));
            setNullableText(ps, 5, a.path("tmuxSession"));
            ps.executeUpdate();
        }
    }

    private int importBuilders(Connection conn, JsonNode builders, long nowMs) throws SQLException {
        int count = 0;
        try (PreparedStatement ps = conn.prepareStatement("""
                INSERT INTO builders(id,name,port,pid,status,phase,workspace,branch,session_name,kind,
                                     task_text,protocol_name,started_at_ms,updated_at_ms)
                VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?,?)
                """)) {
            for (JsonNode b : builders) {
                String id = requiredText(b, "id", "builder");
                ps.setString(1, id);
                ps.setString(2, b.path("name").asText(id));
                ps.setInt(3, requiredPort(b, "builder " + id));
                ps.setLong(4, b.path("pid").asLong(0L));
                ps.setString(5, b.path("status").asText("spawning"));
                ps.setString(6, b.path("phase").asText(""));
                ps.setString(7, b.path("worktree").asText(""));
                ps.setString(8, b.path("branch").asText(""));
                setNullableText(ps, 9, b.path("tmuxSession"));
                ps.setString(10, b.path("type").asText("spec"));
                setNullableText(ps, 11, b.path("taskText"));
                setNullableText(ps, 12, b.path("protocolName"));
                long startedAt = LegacyJson.epochMs(b.path("startedAt"), nowMs);
                ps.setLong(13, startedAt);
                ps.setLong(14, startedAt);
                ps.executeUpdate();
                count++;
            }
        }
        return count;
    }

    private int importUtils(Connection conn, JsonNode utils, long nowMs) throws SQLException {
        int count = 0;
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO utils(id,name,port,pid,session_name,started_at_ms) VALUES(?,?,?,?,?,?)")) {
            for (JsonNode u : utils) {
                String id = requiredText(u, "id", "util");
                ps.setString(1, id);
                ps.setString(2, u.path("name").asText(id));
                ps.setInt(3, requiredPort(u, "util " + id));
                ps.setLong(4, u.path("pid").asLong(0L));
                setNullableText(ps, 5, u.path("tmuxSession"));
                ps.setLong(6, LegacyJson.epochMs(u.path("startedAt"), nowMs));
                ps.executeUpdate();
                count++;
            }
        }
        return count;
    }

    private int importAnnotations(Connection conn, JsonNode annotations, long nowMs) throws SQLException {
        int count = 0;
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO annotations(id,file,port,pid,parent_kind,parent_id,started_at_ms) VALUES(?,?,?,?,?,?,?)")) {
            for (JsonNode n : annotations) {
                String id = requiredText(n, "id", "annotation");
                JsonNode parent = n.path("parent");
                requireParentRow(conn, id, parent);
                ps.setString(1, id);
                ps.setString(2, n.path("file").asText(""));
                ps.setInt(3, requiredPort(n, "annotation " + id));
                ps.setLong(4, n.path("pid").asLong(0L));
                ps.setString(5, parent.path("type").asText("architect"));
                setNullableText(ps, 6, parent.path("id"));
                ps.setLong(7, LegacyJson.epochMs(n.path("startedAt"), nowMs));
                ps.executeUpdate();
                count++;
            }
        }
        return count;
    }

    /**
     * Builder and util parents must already be imported; a dangling reference fails the
     * whole import like a duplicate port does.
     */
    private static void requireParentRow(Connection conn, String annotationId, JsonNode parent) throws SQLException {
        String kind = parent.path("type").asText("architect");
        String table = switch (kind) {
            case "builder" -> "builders";
            case "util" -> "utils";
            default -> null;
        };
        if (table == null) {
            return;
        }
        String parentId = parent.path("id").asText("");
        try (PreparedStatement ps = conn.prepareStatement("SELECT 1 FROM " + table + " WHERE id=?")) {
            ps.setString(1, parentId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw FarmException.notFound("Legacy annotation " + annotationId + " references missing "
                            + kind + " '" + parentId + "'");
                }
            }
        }
    }

    private static String requiredText(JsonNode node, String field, String what) {
        String value = node.path(field).asText("");
        if (value.isBlank()) {
            throw new FarmException(ErrorKind.INVALID_ARGUMENT, "Legacy " + what + " entry has no " + field);
        }
        return value;
    }

    private static int requiredPort(JsonNode node, String what) {
        JsonNode port = node.path("port");
        if (!port.canConvertToInt() || port.asInt() <= 0) {
            throw new FarmException(ErrorKind.INVALID_ARGUMENT, "Legacy " + what + " has no valid port");
        }
        return port.asInt();
    }

    private static void setNullableText(PreparedStatement ps, int index, JsonNode node) throws SQLException {
        if (node.isMissingNode() || node.isNull() || node.asText("").isBlank()) {
            ps.setNull(index, Types.VARCHAR);
        } else {
            ps.setString(index, node.asText());
        }
    }

    static final class LegacyJson {
        private LegacyJson() {
        }

        static JsonNode read(Path file) {
            try {
                return Jsons.mapper().readTree(Files.readString(file));
            } catch (IOException e) {
                throw new FarmException(ErrorKind.INVALID_ARGUMENT, "Failed to parse legacy file " + file + ": " + e.getMessage(), e);
            }
        }

        static long epochMs(JsonNode node, long fallback) {
            if (node.isNumber()) {
                return node.asLong();
            }
            String text = node.asText("");
            if (text.isBlank()) {
                return fallback;
            }
            try {
                return Instant.parse(text).toEpochMilli();
            } catch (DateTimeParseException e) {
                return fallback;
            }
        }

        static void backup(Path file) {
            Path bak = file.resolveSibling(file.getFileName() + ".bak");
            try {
                Files.move(file, bak, StandardCopyOption.REPLACE_EXISTING);
                log.info("Migrated {} (backup at {})", file, bak);
            } catch (IOException e) {
                log.warn("Imported {} but could not rename it to {}: {}", file, bak, e.getMessage());
            }
        }
    }
}
