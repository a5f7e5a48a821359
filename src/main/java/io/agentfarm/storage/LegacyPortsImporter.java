package io.agentfarm.storage;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentfarm.config.RegistrySettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.Iterator;
import java.util.Map;

/**
 * Imports the machine-wide {@code ports.json}. Accepts both the versioned
 * {@code {"version":N,"entries":{...}}} layout and the older direct path-to-entry map.
 */
final class LegacyPortsImporter implements SchemaMigration {
    private static final Logger log = LoggerFactory.getLogger(LegacyPortsImporter.class);

    private final Path jsonFile;
    private final RegistrySettings settings;
    private boolean imported;

    LegacyPortsImporter(Path jsonFile, RegistrySettings settings) {
        this.jsonFile = jsonFile;
        this.settings = settings;
    }

    @Override
    public String version() {
        return LegacyStateImporter.VERSION;
    }

    @Override
    public String description() {
        return "Import legacy ports.json into global.db";
    }

    @Override
    public void apply(Connection conn) throws SQLException {
        imported = false;
        if (!Files.isRegularFile(jsonFile)) {
            return;
        }
        JsonNode data = LegacyStateImporter.LegacyJson.read(jsonFile);
        JsonNode entries = data.has("version") && data.path("entries").isObject() ? data.path("entries") : data;
        long nowMs = Instant.now().toEpochMilli();
        int count = 0;
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO port_allocations(project_path,base_port,pid,registered_at_ms,last_used_at_ms) VALUES(?,?,?,?,?)")) {
            Iterator<Map.Entry<String, JsonNode>> it = entries.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                JsonNode value = entry.getValue();
                if (!value.isObject() || !value.has("basePort")) {
                    continue;
                }
                long registered = LegacyStateImporter.LegacyJson.epochMs(value.path("registered"), nowMs);
                ps.setString(1, entry.getKey());
                ps.setInt(2, value.path("basePort").asInt());
                if (value.path("pid").canConvertToLong() && value.path("pid").asLong() > 0) {
                    ps.setLong(3, value.path("pid").asLong());
                } else {
                    ps.setNull(3, Types.INTEGER);
                }
                ps.setLong(4, registered);
                ps.setLong(5, LegacyStateImporter.LegacyJson.epochMs(value.path("lastUsed"), registered));
                ps.executeUpdate();
                count++;
            }
        } catch (SQLException e) {
            log.error("Import of {} failed, file preserved (floor {}, block {}): {}",
                    jsonFile, settings.floor(), settings.blockSize(), e.getMessage());
            throw e;
        }
        log.info("Importing {}: {} port allocations", jsonFile, count);
        imported = true;
    }

    @Override
    public void afterCommit() {
        if (imported) {
            LegacyStateImporter.LegacyJson.backup(jsonFile);
        }
    }
}
