package io.agentfarm.system;

public record CommandResult(int exitCode, String stdout, String stderr) {
    public boolean success() {
        return exitCode == 0;
    }

    /**
     * Stderr when present, else stdout, trimmed. Used as the cause text of tool failures.
     */
    public String diagnostic() {
        String err = stderr == null ? "" : stderr.trim();
        if (!err.isEmpty()) {
            return err;
        }
        return stdout == null ? "" : stdout.trim();
    }
}
