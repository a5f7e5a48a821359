package io.agentfarm.runtime;

import io.agentfarm.error.FarmException;
import io.agentfarm.model.BuilderKind;

import java.util.List;
import java.util.regex.Pattern;

/**
 * What to spawn. Exactly one mode is set: a spec number, free task text, a protocol name,
 * a bare shell, or a bare worktree.
 */
public record SpawnRequest(
        BuilderKind kind,
        String specId,
        String taskText,
        String protocolName,
        List<String> files
) {
    private static final Pattern SAFE_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");

    public SpawnRequest {
        if (kind == null) {
            throw FarmException.invalid("spawn mode is required");
        }
        files = files == null ? List.of() : List.copyOf(files);
        switch (kind) {
            case SPEC -> requireName(specId, "spec id");
            case TASK -> requireText(taskText, "task text");
            case PROTOCOL -> requireName(protocolName, "protocol name");
            case SHELL, WORKTREE -> {
                // no argument
            }
        }
    }

    public static SpawnRequest spec(String specId) {
        return new SpawnRequest(BuilderKind.SPEC, specId, null, null, List.of());
    }

    public static SpawnRequest task(String taskText, List<String> files) {
        return new SpawnRequest(BuilderKind.TASK, null, taskText, null, files);
    }

    public static SpawnRequest protocol(String protocolName) {
        return new SpawnRequest(BuilderKind.PROTOCOL, null, null, protocolName, List.of());
    }

    public static SpawnRequest shell() {
        return new SpawnRequest(BuilderKind.SHELL, null, null, null, List.of());
    }

    public static SpawnRequest worktree() {
        return new SpawnRequest(BuilderKind.WORKTREE, null, null, null, List.of());
    }

    private static void requireName(String value, String what) {
        requireText(value, what);
        if (!SAFE_NAME.matcher(value).matches()) {
            throw FarmException.invalid(what + " may only contain letters, digits, '.', '_' and '-': " + value);
        }
    }

    private static void requireText(String value, String what) {
        if (value == null || value.isBlank()) {
            throw FarmException.invalid(what + " must not be blank");
        }
        if (!value.equals(value.trim())) {
            throw FarmException.invalid(what + " must not start or end with whitespace");
        }
    }
}
