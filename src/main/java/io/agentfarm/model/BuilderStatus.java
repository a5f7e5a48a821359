package io.agentfarm.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum BuilderStatus {
    SPAWNING("spawning"),
    IMPLEMENTING("implementing"),
    BLOCKED("blocked"),
    PR_READY("pr-ready"),
    COMPLETE("complete");

    private final String wireName;

    BuilderStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Statuses reachable from this one through {@code transition}. The abort path
     * (cleanup) ignores this graph.
     */
    public Set<BuilderStatus> successors() {
        return switch (this) {
            case SPAWNING -> EnumSet.of(IMPLEMENTING);
            case IMPLEMENTING -> EnumSet.of(BLOCKED, PR_READY);
            case BLOCKED -> EnumSet.of(IMPLEMENTING);
            case PR_READY -> EnumSet.of(COMPLETE);
            case COMPLETE -> EnumSet.noneOf(BuilderStatus.class);
        };
    }

    public boolean canMoveTo(BuilderStatus target) {
        return successors().contains(target);
    }

    @JsonCreator
    public static BuilderStatus fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("builder status must not be blank");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (BuilderStatus status : values()) {
            if (status.wireName.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown builder status: " + raw
                + " (expected spawning|implementing|blocked|pr-ready|complete)");
    }

    @Override
    public String toString() {
        return wireName;
    }
}
