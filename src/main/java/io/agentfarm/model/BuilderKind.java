package io.agentfarm.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * What spawned a builder.
 */
public enum BuilderKind {
    SPEC("spec", true),
    TASK("task", true),
    PROTOCOL("protocol", true),
    SHELL("shell", false),
    WORKTREE("worktree", true);

    private final String wireName;
    private final boolean hasWorkspace;

    BuilderKind(String wireName, boolean hasWorkspace) {
        this.wireName = wireName;
        this.hasWorkspace = hasWorkspace;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean hasWorkspace() {
        return hasWorkspace;
    }

    @JsonCreator
    public static BuilderKind fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            return SPEC;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (BuilderKind kind : values()) {
            if (kind.wireName.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown builder kind: " + raw);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
