package io.agentfarm.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Non-owning reference from an annotation viewer to the terminal it was opened from.
 * The architect is addressed without an id; builders and utils by their row id.
 */
public record AnnotationParent(Kind kind, String id) {

    public enum Kind {
        ARCHITECT,
        BUILDER,
        UTIL;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Kind fromWire(String raw) {
            if (raw == null || raw.isBlank()) {
                throw new IllegalArgumentException("annotation parent type must not be blank");
            }
            try {
                return valueOf(raw.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown annotation parent type: " + raw, e);
            }
        }
    }

    public AnnotationParent {
        if (kind == null) {
            throw new IllegalArgumentException("annotation parent kind is required");
        }
        String trimmed = id == null || id.isBlank() ? null : id.trim();
        if (kind == Kind.ARCHITECT && trimmed != null) {
            throw new IllegalArgumentException("architect parent carries no id, got: " + id);
        }
        if (kind != Kind.ARCHITECT && trimmed == null) {
            throw new IllegalArgumentException(kind.wireName() + " parent requires an id");
        }
        id = trimmed;
    }

    public static AnnotationParent architect() {
        return new AnnotationParent(Kind.ARCHITECT, null);
    }

    public static AnnotationParent builder(String builderId) {
        return new AnnotationParent(Kind.BUILDER, builderId);
    }

    public static AnnotationParent util(String utilId) {
        return new AnnotationParent(Kind.UTIL, utilId);
    }

    /**
     * Parses {@code architect}, {@code builder:<id>} or {@code util:<id>}.
     */
    public static AnnotationParent parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return architect();
        }
        String value = raw.trim();
        int colon = value.indexOf(':');
        if (colon < 0) {
            return new AnnotationParent(Kind.fromWire(value), null);
        }
        return new AnnotationParent(Kind.fromWire(value.substring(0, colon)), value.substring(colon + 1));
    }
}
