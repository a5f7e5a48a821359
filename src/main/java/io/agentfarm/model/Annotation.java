package io.agentfarm.model;

public record Annotation(
        String id,
        String file,
        int port,
        long pid,
        AnnotationParent parent,
        long startedAtMs
) {
}
