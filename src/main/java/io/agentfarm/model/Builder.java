package io.agentfarm.model;

public record Builder(
        String id,
        String name,
        int port,
        long pid,
        BuilderStatus status,
        String phase,
        String workspace,
        String branch,
        String sessionName,
        BuilderKind kind,
        String taskText,
        String protocolName,
        long startedAtMs,
        long updatedAtMs
) {
    public Builder withStatus(BuilderStatus next) {
        return new Builder(id, name, port, pid, next, phase, workspace, branch, sessionName, kind,
                taskText, protocolName, startedAtMs, updatedAtMs);
    }

    public Builder withPort(int nextPort) {
        return new Builder(id, name, nextPort, pid, status, phase, workspace, branch, sessionName, kind,
                taskText, protocolName, startedAtMs, updatedAtMs);
    }

    public Builder withPid(long nextPid) {
        return new Builder(id, name, port, nextPid, status, phase, workspace, branch, sessionName, kind,
                taskText, protocolName, startedAtMs, updatedAtMs);
    }

    public boolean hasWorkspace() {
        return workspace != null && !workspace.isBlank();
    }
}
