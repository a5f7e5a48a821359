package io.agentfarm.error;

/**
 * Failure classes surfaced to callers. Each maps to its own CLI exit code.
 */
public enum ErrorKind {
    CAPACITY(2),
    CONFLICT(3),
    NOT_FOUND(4),
    CONTENTION(5),
    EXTERNAL_TOOL(6),
    DIRTY_WORKSPACE(7),
    INVALID_ARGUMENT(8),
    STORAGE(9);

    private final int exitCode;

    ErrorKind(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }

    public boolean retryable() {
        return this == CONTENTION;
    }
}
