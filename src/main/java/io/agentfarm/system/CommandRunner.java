package io.agentfarm.system;

import io.agentfarm.error.ErrorKind;
import io.agentfarm.error.FarmException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs external tools to completion and captures their output.
 */
public class CommandRunner {
    private static final Logger log = LoggerFactory.getLogger(CommandRunner.class);
    private static final long DEFAULT_TIMEOUT_SECONDS = 60;

    public CommandResult run(Path workDir, List<String> command) {
        log.debug("Running: {}", command);
        Process process;
        try {
            ProcessBuilder pb = new ProcessBuilder(command).redirectErrorStream(false);
            if (workDir != null) {
                pb.directory(workDir.toFile());
            }
            process = pb.start();
        } catch (IOException e) {
            throw new FarmException(ErrorKind.EXTERNAL_TOOL,
                    "Failed to run " + command.get(0) + ": " + e.getMessage(), e);
        }
        try {
            process.getOutputStream().close();
            CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()));
            String stdout = drain(process.getInputStream());
            if (!process.waitFor(DEFAULT_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new FarmException(ErrorKind.EXTERNAL_TOOL,
                        command.get(0) + " did not finish within " + DEFAULT_TIMEOUT_SECONDS + "s: " + command);
            }
            CommandResult result = new CommandResult(process.exitValue(), stdout, stderr.get());
            if (!result.success()) {
                log.debug("Command exited with code {}: {}", result.exitCode(), command);
            }
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new FarmException(ErrorKind.EXTERNAL_TOOL, "Interrupted while running " + command.get(0), e);
        } catch (IOException | ExecutionException e) {
            throw new FarmException(ErrorKind.EXTERNAL_TOOL, "Failed to read output of " + command.get(0), e);
        }
    }

    /**
     * Starts a long-lived process detached from this JVM's lifetime and returns its pid.
     * Output goes to {@code logFile}.
     */
    public long startDetached(Path workDir, List<String> command, Path logFile) {
        log.debug("Starting detached: {}", command);
        try {
            ProcessBuilder pb = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectInput(ProcessBuilder.Redirect.from(new File("/dev/null")))
                    .redirectOutput(ProcessBuilder.Redirect.appendTo(logFile.toFile()));
            if (workDir != null) {
                pb.directory(workDir.toFile());
            }
            return pb.start().pid();
        } catch (IOException e) {
            throw new FarmException(ErrorKind.EXTERNAL_TOOL,
                    "Failed to start " + command.get(0) + ": " + e.getMessage(), e);
        }
    }

    private static String drain(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read process output", e);
        }
    }
}
