package io.agentfarm.runtime;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ReconcileReport(
        List<String> orphanSessions,
        List<String> killedSessions,
        List<String> prunedRecords,
        List<String> deadBuilders
) {
    public ReconcileReport {
        orphanSessions = List.copyOf(orphanSessions);
        killedSessions = List.copyOf(killedSessions);
        prunedRecords = List.copyOf(prunedRecords);
        deadBuilders = List.copyOf(deadBuilders);
    }

    /**
     * Sessions terminated plus records pruned.
     */
    @JsonProperty("cleaned")
    public int cleaned() {
        return killedSessions.size() + prunedRecords.size();
    }
}
