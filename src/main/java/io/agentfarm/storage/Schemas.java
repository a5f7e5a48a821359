package io.agentfarm.storage;

import io.agentfarm.config.RegistrySettings;

import java.util.List;

final class Schemas {
    private Schemas() {
    }

    static List<String> registry(RegistrySettings settings) {
        return List.of(
                """
                CREATE TABLE IF NOT EXISTS port_allocations (
                    project_path TEXT PRIMARY KEY,
                    base_port INTEGER NOT NULL UNIQUE
                        CHECK (base_port >= %d AND base_port %% %d = 0),
                    pid INTEGER,
                    registered_at_ms INTEGER NOT NULL,
                    last_used_at_ms INTEGER NOT NULL
                )
                """.formatted(settings.floor(), settings.blockSize()),
                "CREATE INDEX IF NOT EXISTS idx_port_allocations_base_port ON port_allocations(base_port)"
        );
    }

    static List<String> projectState() {
        return List.of(
                """
                CREATE TABLE IF NOT EXISTS architect (
                    id INTEGER PRIMARY KEY CHECK (id = 1),
                    pid INTEGER NOT NULL,
                    port INTEGER NOT NULL,
                    cmd TEXT NOT NULL,
                    started_at_ms INTEGER NOT NULL,
                    session_name TEXT
                )
                """,
                """
                CREATE TABLE IF NOT EXISTS builders (
                    id TEXT PRIMARY KEY,
                    name TEXT NOT NULL,
                    port INTEGER NOT NULL UNIQUE,
                    pid INTEGER NOT NULL DEFAULT 0,
                    status TEXT NOT NULL DEFAULT 'spawning'
                        CHECK (status IN ('spawning', 'implementing', 'blocked', 'pr-ready', 'complete')),
                    phase TEXT NOT NULL DEFAULT '',
                    workspace TEXT NOT NULL DEFAULT '',
                    branch TEXT NOT NULL DEFAULT '',
                    session_name TEXT,
                    kind TEXT NOT NULL DEFAULT 'spec'
                        CHECK (kind IN ('spec', 'task', 'protocol', 'shell', 'worktree')),
                    task_text TEXT,
                    protocol_name TEXT,
                    started_at_ms INTEGER NOT NULL,
                    updated_at_ms INTEGER NOT NULL
                )
                """,
                "CREATE INDEX IF NOT EXISTS idx_builders_status ON builders(status)",
                """
                CREATE TRIGGER IF NOT EXISTS builders_touch_updated_at
                AFTER UPDATE ON builders
                FOR EACH ROW
                WHEN NEW.updated_at_ms = OLD.updated_at_ms
                BEGIN
                    UPDATE builders
                    SET updated_at_ms = MAX(
                        OLD.updated_at_ms + 1,
                        CAST((julianday('now') - 2440587.5) * 86400000 AS INTEGER))
                    WHERE id = NEW.id;
                END
                """,
                """
                CREATE TABLE IF NOT EXISTS utils (
                    id TEXT PRIMARY KEY,
                    name TEXT NOT NULL,
                    port INTEGER NOT NULL UNIQUE,
                    pid INTEGER NOT NULL DEFAULT 0,
                    session_name TEXT,
                    started_at_ms INTEGER NOT NULL
                )
                """,
                """
                CREATE TABLE IF NOT EXISTS annotations (
                    id TEXT PRIMARY KEY,
                    file TEXT NOT NULL,
                    port INTEGER NOT NULL UNIQUE,
                    pid INTEGER NOT NULL DEFAULT 0,
                    parent_kind TEXT NOT NULL CHECK (parent_kind IN ('architect', 'builder', 'util')),
                    parent_id TEXT,
                    started_at_ms INTEGER NOT NULL,
                    CHECK ((parent_kind = 'architect') = (parent_id IS NULL))
                )
                """
        );
    }
}
