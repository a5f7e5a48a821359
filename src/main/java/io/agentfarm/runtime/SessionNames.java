package io.agentfarm.runtime;

import io.agentfarm.config.FarmContext;

/**
 * Multiplexer session names. Every name carries the project's base port: two checkouts
 * may share a directory name but never a port block.
 */
final class SessionNames {
    private SessionNames() {
    }

    static String builder(FarmContext context, String builderId) {
        return "builder-" + context.ports().basePort() + "-" + builderId;
    }

    static String util(FarmContext context, String utilId) {
        return "util-" + context.ports().basePort() + "-" + utilId;
    }

    static String annotation(FarmContext context, String annotationId) {
        return "annotate-" + context.ports().basePort() + "-" + annotationId;
    }
}
