package io.agentfarm.runtime;

import io.agentfarm.error.ErrorKind;
import io.agentfarm.error.FarmException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;

/**
 * Writes the prompt and start script a builder session runs. Both are dot-files with the
 * {@code .builder-} prefix so the dirty check ignores them.
 */
final class LaunchScripts {
    static final String PROMPT_FILE = ".builder-prompt.txt";
    static final String START_SCRIPT = ".builder-start.sh";

    private LaunchScripts() {
    }

    /**
     * @return the command the session should run
     */
    static String write(Path workspace, String agentCommand, String prompt) {
        Path script = workspace.resolve(START_SCRIPT);
        StringBuilder content = new StringBuilder()
                .append("#!/bin/bash\n")
                .append("cd ").append(quote(workspace.toString())).append('\n');
        try {
            if (prompt == null || prompt.isBlank()) {
                content.append("exec ").append(agentCommand).append('\n');
            } else {
                Files.writeString(workspace.resolve(PROMPT_FILE), prompt, StandardCharsets.UTF_8);
                content.append("exec ").append(agentCommand)
                        .append(" \"$(cat ").append(PROMPT_FILE).append(")\"\n");
            }
            Files.writeString(script, content.toString(), StandardCharsets.UTF_8);
            makeExecutable(script);
        } catch (IOException e) {
            throw new FarmException(ErrorKind.EXTERNAL_TOOL, "Failed to write launch script in " + workspace, e);
        }
        return script.toString();
    }

    static String quote(String value) {
        return "'" + value.replace("'", "'\\''") + "'";
    }

    private static void makeExecutable(Path script) throws IOException {
        try {
            Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwxr-xr-x"));
        } catch (UnsupportedOperationException e) {
            if (!script.toFile().setExecutable(true)) {
                throw new IOException("Cannot mark " + script + " executable", e);
            }
        }
    }
}
