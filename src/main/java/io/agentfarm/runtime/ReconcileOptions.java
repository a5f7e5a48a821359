package io.agentfarm.runtime;

/**
 * @param kill   terminate orphan sessions and prune stale records; otherwise only report
 * @param silent suppress log output
 */
public record ReconcileOptions(boolean kill, boolean silent) {
    public static ReconcileOptions report() {
        return new ReconcileOptions(false, false);
    }

    public static ReconcileOptions killing() {
        return new ReconcileOptions(true, false);
    }
}
